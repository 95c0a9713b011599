package org.example.kbsync.config;

import lombok.Data;
import org.example.kbsync.entity.InstanceTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "kb.deployment")
public class DeploymentProperties {

    private InstanceTier tier = InstanceTier.CLOUD;

    private long maxUploadSizeMb = 50;

    // 以下两项只在 local 实例上生效
    private boolean ocrEnabled = true;
    private String ocrLanguage = "eng";

    public long maxUploadSizeBytes() {
        return maxUploadSizeMb * 1024 * 1024;
    }
}
