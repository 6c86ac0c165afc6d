package com.scholary.recordings.callrecord;

/** Decides whether a caller may upload or play back the recording of a call record. */
public interface RecordingAccessPolicy {

  boolean canAccess(CallerIdentity caller, CallRecord record);
}
