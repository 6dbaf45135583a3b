/**
 * Application services: the engine boundary and its whisper.cpp adapter, the streaming
 * pipeline, audio conversions, transcript fan-out, metrics and health.
 */
package com.phillippitts.streamscribe.service;
