package com.scholary.recordings.callrecord;

/**
 * The authenticated caller, as forwarded by the gateway in front of this service.
 *
 * @param agentId the agent's user id
 * @param admin whether the caller has the admin role
 */
public record CallerIdentity(String agentId, boolean admin) {

  public static CallerIdentity agent(String agentId) {
    return new CallerIdentity(agentId, false);
  }
}
