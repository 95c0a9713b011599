package org.example.kbsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.common.Result;
import org.example.kbsync.common.ResultCode;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * 校验 /api/sync/** 的机器间共享密钥，在触及任何文档状态之前拒绝非法请求
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncApiKeyFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-Sync-API-Key";
    public static final String SYNC_PATH_PREFIX = "/api/sync/";
    public static final String ROLE_SYNC = "ROLE_SYNC";

    private final SyncProperties syncProperties;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(request.getContextPath() + SYNC_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        //服务端没有配置密钥时同步接口整体不可用
        if (!syncProperties.hasApiKey()) {
            reject(response, ResultCode.SERVICE_UNAVAILABLE);
            return;
        }
        String header = request.getHeader(API_KEY_HEADER);
        if (header == null || header.isBlank()) {
            reject(response, ResultCode.UNAUTHORIZED);
            return;
        }
        if (!MessageDigest.isEqual(header.getBytes(StandardCharsets.UTF_8),
                syncProperties.getApiKey().getBytes(StandardCharsets.UTF_8))) {
            log.warn("同步密钥无效，来源: {} {}", request.getRemoteAddr(), request.getRequestURI());
            reject(response, ResultCode.FORBIDDEN);
            return;
        }
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                "sync-peer", null, List.of(new SimpleGrantedAuthority(ROLE_SYNC)));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        try {
            filterChain.doFilter(request, response);
        } finally {
            SecurityContextHolder.clearContext();
        }
    }

    private void reject(HttpServletResponse response, ResultCode code) throws IOException {
        response.setStatus(code.getCode());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), Result.failed(code));
    }
}
