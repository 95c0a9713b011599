package org.example.kbsync.support;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.kbsync.config.SyncApiKeyFilter;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.repository.KbDocumentRepository;
import org.example.kbsync.repository.KnowledgeEntryRepository;
import org.example.kbsync.repository.SyncConflictRepository;
import org.example.kbsync.repository.SyncLogRepository;
import org.example.kbsync.repository.SyncMetadataRepository;
import org.example.kbsync.service.DocumentEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.nio.charset.StandardCharsets;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 集成测试基类：H2 + MockMvc + 可控时钟，RabbitMQ 发送端被替换为 mock。
 * 所有子类共用同一个 Spring 上下文，每个用例前清空数据。
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class IntegrationTestSupport {

    public static final String API_KEY = "test-sync-key";

    @Autowired
    protected MockMvc mockMvc;
    @Autowired
    protected ObjectMapper objectMapper;
    @Autowired
    protected MutableClock clock;
    @Autowired
    protected KbDocumentRepository kbDocumentRepository;
    @Autowired
    protected KnowledgeEntryRepository knowledgeEntryRepository;
    @Autowired
    protected SyncLogRepository syncLogRepository;
    @Autowired
    protected SyncMetadataRepository syncMetadataRepository;
    @Autowired
    protected SyncConflictRepository syncConflictRepository;

    @MockBean
    protected DocumentEventPublisher documentEventPublisher;

    @BeforeEach
    void resetState() {
        clock.set(TestClockConfig.START);
        syncConflictRepository.deleteAll();
        syncLogRepository.deleteAll();
        syncMetadataRepository.deleteAll();
        knowledgeEntryRepository.deleteAll();
        kbDocumentRepository.deleteAll();
    }

    protected static MockHttpServletRequestBuilder withKey(MockHttpServletRequestBuilder builder) {
        return builder.header(SyncApiKeyFilter.API_KEY_HEADER, API_KEY);
    }

    /**
     * 上传文件并返回文档 id
     */
    protected Long upload(String filename, byte[] data) throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", filename, "application/octet-stream", data);
        MvcResult result = mockMvc.perform(multipart("/api/documents/upload").file(file).param("title", filename))
                .andExpect(status().isOk())
                .andReturn();
        return readTree(result).path("data").path("id").asLong();
    }

    protected Long upload(String filename, String text) throws Exception {
        return upload(filename, text.getBytes(StandardCharsets.UTF_8));
    }

    protected KbDocument reload(Long id) {
        return kbDocumentRepository.findById(id).orElseThrow();
    }

    protected JsonNode readTree(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString(StandardCharsets.UTF_8));
    }

    protected <T> T readData(MvcResult result, TypeReference<T> type) throws Exception {
        JsonNode data = readTree(result).path("data");
        return objectMapper.convertValue(data, type);
    }

    protected String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }
}
