/**
 * Transaction data handed over by the receiving SMTP layer.
 */
package com.mimecast.wren.smtp;
