/*
 * どこで: Team Balancer Web 層
 * 何を: リクエスト単位の運用キー (request/user/session) を MDC へ出し入れする
 * なぜ: 同じセッションへの操作ログを session_id で横断検索できるようにするため
 */
package com.example.teambalancer.config;

import com.example.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";
  static final String HEADER_USER_ID = "X-User-Id";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> values = new LinkedHashMap<>();
    values.put("request_id", TraceIds.firstOrNew(request.getHeader(HEADER_REQUEST_ID)));
    values.put("http_method", request.getMethod());
    values.put("http_path", request.getRequestURI());
    values.put("client_ip", clientIp(request));
    values.put("user_id", request.getHeader(HEADER_USER_ID));
    values.put("session_id", sessionId(request));

    final List<String> applied = new ArrayList<>();
    values.forEach(
        (key, value) -> {
          if (value != null && !value.isBlank()) {
            MDC.put(key, value);
            applied.add(key);
          }
        });
    request.setAttribute(ATTRIBUTE_KEYS, List.copyOf(applied));
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    // 自分が積んだキーだけを外す。
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> keys) {
      keys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private String clientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  private String sessionId(HttpServletRequest request) {
    // パス変数はハンドラ解決時に request 属性へ展開済み。
    if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
            instanceof Map<?, ?> variables
        && variables.get("sessionId") instanceof String sessionId) {
      return sessionId;
    }
    return null;
  }
}
