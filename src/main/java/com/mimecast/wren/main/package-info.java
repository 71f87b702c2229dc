/**
 * Configuration container and handler factories.
 */
package com.mimecast.wren.main;
