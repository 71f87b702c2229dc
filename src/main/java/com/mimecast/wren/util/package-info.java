/**
 * Static helpers.
 */
package com.mimecast.wren.util;
