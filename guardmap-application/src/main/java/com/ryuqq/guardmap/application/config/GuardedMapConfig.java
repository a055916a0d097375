package com.ryuqq.guardmap.application.config;

import com.ryuqq.guardmap.core.lock.LockPolicyType;
import com.ryuqq.guardmap.core.memory.FragmentationMonitor;
import com.ryuqq.guardmap.core.memory.MemoryConfig;
import com.ryuqq.guardmap.core.transfer.RetryPolicy;
import com.ryuqq.guardmap.core.transfer.TransferConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * GuardedMap 설정 (불변 record).
 *
 * <p><strong>설정 항목 (properties 키):</strong></p>
 * <ul>
 *   <li>memory_ceiling_bytes: 메모리 상한 (기본 무제한)</li>
 *   <li>fragmentation_threshold_pct: 단편화 임계값 0~100 (기본 20)</li>
 *   <li>fragmentation_check_interval_ops: 단편화 샘플링 주기 (기본 1000)</li>
 *   <li>max_eviction_attempts: 쓰기 1회당 최대 퇴출 수 (기본 10)</li>
 *   <li>transfer_timeout_ms: 전송 시도 1회 제한 시간 (기본 30000ms)</li>
 *   <li>max_retries: 첫 시도를 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>retry_initial_delay_ms: 선형 백오프 초기 지연 (기본 1000ms)</li>
 *   <li>lock_policy: shared-exclusive | exclusive | none (기본 shared-exclusive)</li>
 * </ul>
 *
 * @author GuardMap Team
 * @since 1.0.0
 * @param memoryCeilingBytes 메모리 상한 (bytes, 양수)
 * @param fragmentationThresholdPct 단편화 임계값 (0~100)
 * @param fragmentationCheckIntervalOps 단편화 샘플링 주기 (양수)
 * @param maxEvictionAttempts 쓰기 1회당 최대 퇴출 수 (0 이상)
 * @param transferTimeoutMs 전송 제한 시간 (밀리초, 양수)
 * @param maxRetries 최대 시도 횟수 (1 이상)
 * @param retryInitialDelayMs 재시도 초기 지연 (밀리초, 0 이상)
 * @param lockPolicy 락 정책
 */
public record GuardedMapConfig(
    long memoryCeilingBytes,
    double fragmentationThresholdPct,
    long fragmentationCheckIntervalOps,
    int maxEvictionAttempts,
    long transferTimeoutMs,
    int maxRetries,
    long retryInitialDelayMs,
    LockPolicyType lockPolicy
) {

    public static final String MEMORY_CEILING_BYTES = "memory_ceiling_bytes";
    public static final String FRAGMENTATION_THRESHOLD_PCT = "fragmentation_threshold_pct";
    public static final String FRAGMENTATION_CHECK_INTERVAL_OPS = "fragmentation_check_interval_ops";
    public static final String MAX_EVICTION_ATTEMPTS = "max_eviction_attempts";
    public static final String TRANSFER_TIMEOUT_MS = "transfer_timeout_ms";
    public static final String MAX_RETRIES = "max_retries";
    public static final String RETRY_INITIAL_DELAY_MS = "retry_initial_delay_ms";
    public static final String LOCK_POLICY = "lock_policy";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: memoryCeilingBytes=무제한, fragmentationThresholdPct=20, checkInterval=1000,
     * maxEvictionAttempts=10, transferTimeoutMs=30000, maxRetries=3, retryInitialDelayMs=1000,
     * lockPolicy=SHARED_EXCLUSIVE</p>
     */
    public GuardedMapConfig() {
        this(
            MemoryConfig.UNBOUNDED,
            FragmentationMonitor.DEFAULT_THRESHOLD_PCT,
            FragmentationMonitor.DEFAULT_CHECK_INTERVAL_OPS,
            MemoryConfig.DEFAULT_MAX_EVICTION_ATTEMPTS,
            TransferConfig.DEFAULT_TIMEOUT.toMillis(),
            RetryPolicy.DEFAULT_MAX_ATTEMPTS,
            RetryPolicy.DEFAULT_INITIAL_DELAY.toMillis(),
            LockPolicyType.SHARED_EXCLUSIVE
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GuardedMapConfig {
        if (memoryCeilingBytes <= 0) {
            throw new IllegalArgumentException(
                "memoryCeilingBytes must be positive (current: " + memoryCeilingBytes + ")"
            );
        }
        if (Double.isNaN(fragmentationThresholdPct)
            || fragmentationThresholdPct < 0.0 || fragmentationThresholdPct > 100.0) {
            throw new IllegalArgumentException(
                "fragmentationThresholdPct must be between 0 and 100 (current: " + fragmentationThresholdPct + ")"
            );
        }
        if (fragmentationCheckIntervalOps <= 0) {
            throw new IllegalArgumentException(
                "fragmentationCheckIntervalOps must be positive (current: " + fragmentationCheckIntervalOps + ")"
            );
        }
        if (maxEvictionAttempts < 0) {
            throw new IllegalArgumentException(
                "maxEvictionAttempts must be non-negative (current: " + maxEvictionAttempts + ")"
            );
        }
        if (transferTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "transferTimeoutMs must be positive (current: " + transferTimeoutMs + ")"
            );
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException(
                "maxRetries must be positive (current: " + maxRetries + ")"
            );
        }
        if (retryInitialDelayMs < 0) {
            throw new IllegalArgumentException(
                "retryInitialDelayMs must be non-negative (current: " + retryInitialDelayMs + ")"
            );
        }
        if (lockPolicy == null) {
            throw new IllegalArgumentException("lockPolicy cannot be null");
        }
    }

    /**
     * properties에서 설정을 읽습니다. 없는 키는 기본값을 사용합니다.
     *
     * @param properties 설정 값
     * @return 설정
     * @throws IllegalArgumentException 값 형식이 잘못된 경우
     */
    public static GuardedMapConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        GuardedMapConfig defaults = new GuardedMapConfig();
        return new GuardedMapConfig(
            longValue(properties, MEMORY_CEILING_BYTES, defaults.memoryCeilingBytes),
            doubleValue(properties, FRAGMENTATION_THRESHOLD_PCT, defaults.fragmentationThresholdPct),
            longValue(properties, FRAGMENTATION_CHECK_INTERVAL_OPS, defaults.fragmentationCheckIntervalOps),
            (int) longValue(properties, MAX_EVICTION_ATTEMPTS, defaults.maxEvictionAttempts),
            longValue(properties, TRANSFER_TIMEOUT_MS, defaults.transferTimeoutMs),
            (int) longValue(properties, MAX_RETRIES, defaults.maxRetries),
            longValue(properties, RETRY_INITIAL_DELAY_MS, defaults.retryInitialDelayMs),
            properties.containsKey(LOCK_POLICY)
                ? LockPolicyType.fromConfigValue(properties.getProperty(LOCK_POLICY))
                : defaults.lockPolicy
        );
    }

    /**
     * 클래스패스 리소스에서 설정을 읽습니다.
     *
     * @param resource 리소스 경로 (예: {@code guardmap.properties})
     * @return 설정
     * @throws IllegalArgumentException 리소스가 없는 경우
     */
    public static GuardedMapConfig fromClasspath(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = GuardedMapConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("config resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config resource: " + resource, e);
        }
    }

    public MemoryConfig memoryConfig() {
        return new MemoryConfig(
            memoryCeilingBytes,
            fragmentationThresholdPct,
            fragmentationCheckIntervalOps,
            maxEvictionAttempts
        );
    }

    public TransferConfig transferConfig() {
        return new TransferConfig(
            Duration.ofMillis(transferTimeoutMs),
            RetryPolicy.linear(maxRetries, Duration.ofMillis(retryInitialDelayMs))
        );
    }

    /**
     * memoryCeilingBytes만 변경한 새 인스턴스 생성.
     */
    public GuardedMapConfig withMemoryCeilingBytes(long memoryCeilingBytes) {
        return new GuardedMapConfig(memoryCeilingBytes, fragmentationThresholdPct, fragmentationCheckIntervalOps,
            maxEvictionAttempts, transferTimeoutMs, maxRetries, retryInitialDelayMs, lockPolicy);
    }

    public GuardedMapConfig withFragmentationThresholdPct(double fragmentationThresholdPct) {
        return new GuardedMapConfig(memoryCeilingBytes, fragmentationThresholdPct, fragmentationCheckIntervalOps,
            maxEvictionAttempts, transferTimeoutMs, maxRetries, retryInitialDelayMs, lockPolicy);
    }

    public GuardedMapConfig withFragmentationCheckIntervalOps(long fragmentationCheckIntervalOps) {
        return new GuardedMapConfig(memoryCeilingBytes, fragmentationThresholdPct, fragmentationCheckIntervalOps,
            maxEvictionAttempts, transferTimeoutMs, maxRetries, retryInitialDelayMs, lockPolicy);
    }

    public GuardedMapConfig withMaxEvictionAttempts(int maxEvictionAttempts) {
        return new GuardedMapConfig(memoryCeilingBytes, fragmentationThresholdPct, fragmentationCheckIntervalOps,
            maxEvictionAttempts, transferTimeoutMs, maxRetries, retryInitialDelayMs, lockPolicy);
    }

    /**
     * transferTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public GuardedMapConfig withTransferTimeoutMs(long transferTimeoutMs) {
        return new GuardedMapConfig(memoryCeilingBytes, fragmentationThresholdPct, fragmentationCheckIntervalOps,
            maxEvictionAttempts, transferTimeoutMs, maxRetries, retryInitialDelayMs, lockPolicy);
    }

    public GuardedMapConfig withMaxRetries(int maxRetries) {
        return new GuardedMapConfig(memoryCeilingBytes, fragmentationThresholdPct, fragmentationCheckIntervalOps,
            maxEvictionAttempts, transferTimeoutMs, maxRetries, retryInitialDelayMs, lockPolicy);
    }

    public GuardedMapConfig withRetryInitialDelayMs(long retryInitialDelayMs) {
        return new GuardedMapConfig(memoryCeilingBytes, fragmentationThresholdPct, fragmentationCheckIntervalOps,
            maxEvictionAttempts, transferTimeoutMs, maxRetries, retryInitialDelayMs, lockPolicy);
    }

    /**
     * lockPolicy만 변경한 새 인스턴스 생성.
     */
    public GuardedMapConfig withLockPolicy(LockPolicyType lockPolicy) {
        return new GuardedMapConfig(memoryCeilingBytes, fragmentationThresholdPct, fragmentationCheckIntervalOps,
            maxEvictionAttempts, transferTimeoutMs, maxRetries, retryInitialDelayMs, lockPolicy);
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + raw + ")", e);
        }
    }

    private static double doubleValue(Properties properties, String key, double defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + raw + ")", e);
        }
    }
}
