/**
 * whisper.cpp engine configuration ({@code stt.whisper.*}).
 */
package com.phillippitts.streamscribe.config.stt;
