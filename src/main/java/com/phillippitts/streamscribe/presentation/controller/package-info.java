/**
 * REST controllers.
 */
package com.phillippitts.streamscribe.presentation.controller;
