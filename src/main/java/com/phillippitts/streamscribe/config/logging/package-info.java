/**
 * Logging configuration (Log4j2 ThreadContext population for HTTP requests).
 */
package com.phillippitts.streamscribe.config.logging;
