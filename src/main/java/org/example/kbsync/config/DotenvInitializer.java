package org.example.kbsync.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * 启动时读取工作目录下的 .env 文件，作为最低优先级的配置来源。
 * 真实环境变量与 application.yml 中的显式配置始终优先。
 */
@Slf4j
public class DotenvInitializer implements ApplicationContextInitializer<ConfigurableApplicationContext> {

    static final String PROPERTY_SOURCE_NAME = "dotenv";

    @Override
    public void initialize(ConfigurableApplicationContext applicationContext) {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();
        Map<String, Object> values = new HashMap<>();
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            values.put(entry.getKey(), entry.getValue());
        }
        if (values.isEmpty()) {
            return;
        }
        applicationContext.getEnvironment().getPropertySources()
                .addLast(new MapPropertySource(PROPERTY_SOURCE_NAME, values));
        log.info("已加载 .env 配置项 {} 个", values.size());
    }
}
