/**
 * Logging infrastructure: request-scoped Log4j2 ThreadContext values.
 *
 * @see com.phillippitts.recorderbridge.config.logging.MdcFilter
 */
package com.phillippitts.recorderbridge.config.logging;
