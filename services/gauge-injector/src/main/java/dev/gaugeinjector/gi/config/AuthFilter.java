package dev.gaugeinjector.gi.config;

import java.io.IOException;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import dev.gaugeinjector.gi.util.Addresses;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class AuthFilter extends OncePerRequestFilter {
  public static final String CALLER_ATTRIBUTE = "gi.caller";
  public static final String CALLER_HEADER = "X-Caller-Address";

  private final GiAuthProperties props;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    if (path.startsWith("/actuator"))
      return true;
    return "OPTIONS".equalsIgnoreCase(request.getMethod());
  }

  @Override
  protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
      throws ServletException, IOException {
    String caller;
    if (props.isEnabled()) {
      String auth = req.getHeader("Authorization");
      if (auth != null && auth.startsWith("Bearer "))
        auth = auth.substring(7);
      caller = auth == null ? null : props.getCallers().get(auth);
    } else {
      caller = req.getHeader(CALLER_HEADER);
    }

    if (!Addresses.isValid(caller)) {
      res.setStatus(HttpStatus.UNAUTHORIZED.value());
      res.setContentType(MediaType.APPLICATION_JSON_VALUE);
      res.getWriter().write("{\"code\":\"UNAUTHENTICATED\",\"message\":\"no caller identity\"}");
      return;
    }
    req.setAttribute(CALLER_ATTRIBUTE, Addresses.normalize(caller));
    chain.doFilter(req, res);
  }
}
