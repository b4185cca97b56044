/*
 * どこで: Notification HTTP 入口
 * 何を: 読み取り API のリクエストごとに request_id / trace_id / user_id を MDC に載せる
 * なぜ: 既読化や一覧取得のログを、配信側のログと同じキーで突き合わせるため
 */
package io.eventboard.notification.config;

import io.eventboard.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String TRACE_ID_HEADER = "X-Trace-Id";

  private static final String ADDED_KEYS = RequestMdcInterceptor.class.getName() + ".ADDED_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> added = new ArrayList<>();
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    putIfAbsent(
        added,
        "request_id",
        requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId);
    putIfAbsent(added, "trace_id", TraceIds.resolve(request.getHeader(TRACE_ID_HEADER)));
    putIfAbsent(added, "user_id", authenticatedUser());
    putIfAbsent(added, "http_method", request.getMethod());
    putIfAbsent(added, "http_path", request.getRequestURI());
    request.setAttribute(ADDED_KEYS, added);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    // 自分が追加したキーだけを外し、上流で載せられた値は残す
    if (request.getAttribute(ADDED_KEYS) instanceof List<?> added) {
      added.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private static String authenticatedUser() {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      return null;
    }
    return authentication.getName();
  }

  private static void putIfAbsent(List<String> added, String key, String value) {
    if (value == null || value.isBlank() || MDC.get(key) != null) {
      return;
    }
    MDC.put(key, value);
    added.add(key);
  }
}
