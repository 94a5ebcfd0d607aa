/**
 * Logging support: request correlation through Log4j2's ThreadContext.
 */
package com.phillippitts.meetingscribe.config.logging;
