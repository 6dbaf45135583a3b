/**
 * Maps domain exceptions to HTTP error responses.
 */
package com.phillippitts.streamscribe.presentation.exception;
