/**
 * Audio format constants and conversions between float samples, float32 wire bytes and PCM16 WAV.
 */
package com.phillippitts.streamscribe.service.audio;
