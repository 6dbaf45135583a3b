/**
 * whisper.cpp adapter: runs the CLI as a subprocess per inference call and parses its full JSON
 * output into segments and tokens.
 */
package com.phillippitts.streamscribe.service.engine.whisper;
