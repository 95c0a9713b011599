package org.example.kbsync.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.common.Result;
import org.example.kbsync.entity.dto.ClaimRequest;
import org.example.kbsync.entity.dto.ClaimResponse;
import org.example.kbsync.entity.dto.ProcessedContentRequest;
import org.example.kbsync.entity.dto.PullResponse;
import org.example.kbsync.entity.dto.PushRequest;
import org.example.kbsync.entity.dto.PushResponse;
import org.example.kbsync.entity.dto.ReleaseRequest;
import org.example.kbsync.entity.dto.SubmitResponse;
import org.example.kbsync.entity.dto.UnprocessedPage;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 基于 RestTemplate 的同步客户端。根地址、同步密钥与超时在构建 RestTemplate 时设置。
 */
@Slf4j
@RequiredArgsConstructor
public class RestSyncClient implements SyncClient {

    public static final String CLAIM_TOKEN_HEADER = "X-Claim-Token";

    private final RestTemplate restTemplate;

    @Override
    public UnprocessedPage listUnprocessed(String cursor, int limit) {
        String uri = UriComponentsBuilder.fromPath("/api/sync/documents/unprocessed")
                .queryParam("limit", limit)
                .queryParamIfPresent("cursor", Optional.ofNullable(cursor))
                .toUriString();
        return call("列出待处理文档", () -> exchange(uri, HttpMethod.GET, null,
                new ParameterizedTypeReference<Result<UnprocessedPage>>() {
                }));
    }

    @Override
    public ClaimResponse claim(Long documentId, String claimToken) {
        return call("认领文档 " + documentId, () -> exchange("/api/sync/documents/" + documentId + "/claim",
                HttpMethod.POST, new HttpEntity<>(new ClaimRequest(claimToken)),
                new ParameterizedTypeReference<Result<ClaimResponse>>() {
                }));
    }

    @Override
    public byte[] download(Long documentId, String leaseToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(CLAIM_TOKEN_HEADER, leaseToken);
        return call("下载文档 " + documentId, () -> {
            ResponseEntity<byte[]> response = restTemplate.exchange("/api/sync/documents/" + documentId + "/download",
                    HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
            return response.getBody() == null ? new byte[0] : response.getBody();
        });
    }

    @Override
    public SubmitResponse submit(Long documentId, ProcessedContentRequest request) {
        return call("提交文档 " + documentId, () -> exchange("/api/sync/documents/" + documentId + "/processed",
                HttpMethod.POST, new HttpEntity<>(request),
                new ParameterizedTypeReference<Result<SubmitResponse>>() {
                }));
    }

    @Override
    public void release(Long documentId, String leaseToken, String reason) {
        call("释放文档 " + documentId, () -> exchange("/api/sync/documents/" + documentId + "/release",
                HttpMethod.POST, new HttpEntity<>(new ReleaseRequest(leaseToken, reason)),
                new ParameterizedTypeReference<Result<Object>>() {
                }));
    }

    @Override
    public PushResponse push(PushRequest request) {
        return call("批量推送", () -> exchange("/api/sync/push", HttpMethod.POST, new HttpEntity<>(request),
                new ParameterizedTypeReference<Result<PushResponse>>() {
                }));
    }

    @Override
    public PullResponse pull(Instant since, String cursor, int limit) {
        String uri = UriComponentsBuilder.fromPath("/api/sync/pull")
                .queryParam("limit", limit)
                .queryParamIfPresent("since", Optional.ofNullable(since).map(Instant::toString))
                .queryParamIfPresent("cursor", Optional.ofNullable(cursor))
                .toUriString();
        return call("拉取变更", () -> exchange(uri, HttpMethod.GET, null,
                new ParameterizedTypeReference<Result<PullResponse>>() {
                }));
    }

    private <T> T exchange(String uri, HttpMethod method, HttpEntity<?> entity,
                           ParameterizedTypeReference<Result<T>> type) {
        ResponseEntity<Result<T>> response = restTemplate.exchange(uri, method, entity, type);
        Result<T> body = response.getBody();
        if (body == null) {
            throw new SyncTransportException("cloud 返回空响应: " + uri, null);
        }
        if (!body.isSuccess()) {
            throw SyncClientException.fromStatus(body.getCode(), body.getMessage(), null);
        }
        return body.getData();
    }

    private <T> T call(String action, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            log.warn("{}失败，HTTP {}: {}", action, status, e.getResponseBodyAsString());
            throw SyncClientException.fromStatus(status, e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            log.warn("{}失败，无法连接 cloud: {}", action, e.getMessage());
            throw new SyncTransportException(action + "失败: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.warn("{}失败: {}", action, e.getMessage());
            throw new SyncTransportException(action + "失败: " + e.getMessage(), e);
        }
    }
}
