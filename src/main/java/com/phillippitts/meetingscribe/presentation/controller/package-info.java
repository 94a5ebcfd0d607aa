/**
 * HTTP controllers for submitting and observing transcription jobs.
 */
package com.phillippitts.meetingscribe.presentation.controller;
