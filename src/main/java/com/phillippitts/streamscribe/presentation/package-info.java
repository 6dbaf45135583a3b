/**
 * HTTP boundary: controllers and exception mapping.
 */
package com.phillippitts.streamscribe.presentation;
