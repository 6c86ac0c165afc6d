package com.scholary.recordings.callrecord;

import org.springframework.stereotype.Component;

/** Agents may act on their own call records; admins on all of them. */
@Component
public class OwnerOrAdminAccessPolicy implements RecordingAccessPolicy {

  @Override
  public boolean canAccess(CallerIdentity caller, CallRecord record) {
    return caller.admin() || caller.agentId().equals(record.getAgentId());
  }
}
