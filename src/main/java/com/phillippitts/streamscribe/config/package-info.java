/**
 * Spring configuration: typed properties, bean wiring for the engine and the pipeline, and
 * request-scoped logging context.
 */
package com.phillippitts.streamscribe.config;
