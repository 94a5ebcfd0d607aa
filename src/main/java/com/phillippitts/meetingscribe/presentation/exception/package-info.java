/**
 * Translation of domain exceptions into HTTP error responses.
 */
package com.phillippitts.meetingscribe.presentation.exception;
