/**
 * The inference engine boundary: {@link com.phillippitts.streamscribe.service.engine.Engine},
 * its loader and the sink receiving its diagnostic output.
 *
 * <p>The pipeline treats an engine as a black box. The only concrete implementation lives in
 * {@code engine.whisper} and drives the whisper.cpp command-line binary.
 */
package com.phillippitts.streamscribe.service.engine;
