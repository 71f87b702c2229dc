/**
 * JSON5 configuration with type safe accessors.
 */
package com.mimecast.wren.config;
