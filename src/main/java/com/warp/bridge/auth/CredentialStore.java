package com.warp.bridge.auth;

import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 凭证存储
 * <p>
 * 进程内单实例，提供原子读取/替换。配置了 cache-file 时同时写入磁盘，
 * 重启后从文件恢复（过期时间仍从 token 声明中重新解析）
 */
@Component
public class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    private final AtomicReference<Credential> current = new AtomicReference<>();
    private final Path cacheFile;

    public CredentialStore(AppProperties properties) {
        String file = properties.getCredentials().getCacheFile();
        this.cacheFile = file == null || file.isBlank() ? null : Path.of(file);
        loadFromCache();
    }

    public Optional<Credential> get() {
        return Optional.ofNullable(current.get());
    }

    /**
     * 替换当前凭证
     */
    public void replace(Credential credential) {
        current.set(credential);
        persist(credential);
    }

    /**
     * 丢弃当前凭证，同时删除缓存文件，避免重启后恢复已作废的身份
     */
    public void clear() {
        current.set(null);
        if (cacheFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(cacheFile);
        } catch (IOException e) {
            log.warn("删除凭证缓存文件失败: {}", e.getMessage());
        }
    }

    private void loadFromCache() {
        if (cacheFile == null || !Files.exists(cacheFile)) {
            return;
        }
        try {
            JSONObject json = JSONObject.parseObject(Files.readString(cacheFile, StandardCharsets.UTF_8));
            if (json == null) {
                return;
            }
            Credential credential = Credential.of(json.getString("accessToken"), json.getString("refreshToken"));
            current.set(credential);
            log.info("从缓存文件恢复凭证: {}, 过期时间: {}", cacheFile, credential.expiresAt());
        } catch (IOException | RuntimeException e) {
            log.warn("读取凭证缓存文件失败: {}", e.getMessage());
        }
    }

    private void persist(Credential credential) {
        if (cacheFile == null) {
            return;
        }
        JSONObject json = JSONObject.of(
                "accessToken", credential.accessToken(), //
                "refreshToken", credential.refreshToken() //
        );
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
            Files.writeString(tmp, json.toJSONString(), StandardCharsets.UTF_8);
            Files.move(tmp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            // 持久化只是优化，失败不影响内存中的凭证
            log.warn("写入凭证缓存文件失败: {}", e.getMessage());
        }
    }
}
