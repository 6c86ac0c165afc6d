package com.scholary.recordings.api;

import com.scholary.recordings.callrecord.CallerIdentity;
import com.scholary.recordings.error.AuthorizationException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CallerIdentity} controller arguments from the headers set by the gateway.
 *
 * <p>{@code X-Agent-Id} is required. {@code X-Agent-Role: admin} grants access to every record.
 */
public class CallerIdentityResolver implements HandlerMethodArgumentResolver {

  public static final String AGENT_ID_HEADER = "X-Agent-Id";
  public static final String AGENT_ROLE_HEADER = "X-Agent-Role";

  private static final String ADMIN_ROLE = "admin";

  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return CallerIdentity.class.equals(parameter.getParameterType());
  }

  @Override
  public CallerIdentity resolveArgument(
      MethodParameter parameter,
      ModelAndViewContainer mavContainer,
      NativeWebRequest webRequest,
      WebDataBinderFactory binderFactory) {
    String agentId = webRequest.getHeader(AGENT_ID_HEADER);
    if (agentId == null || agentId.isBlank()) {
      throw new AuthorizationException("Missing caller identity");
    }
    String role = webRequest.getHeader(AGENT_ROLE_HEADER);
    return new CallerIdentity(agentId.trim(), ADMIN_ROLE.equalsIgnoreCase(role));
  }
}
