/**
 * Startup checks of the transcription installation.
 */
package com.phillippitts.meetingscribe.config.transcription;
