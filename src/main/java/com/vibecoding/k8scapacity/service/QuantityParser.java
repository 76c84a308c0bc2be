package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.model.BareNumberConvention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;

/**
 * 클러스터 quantity 문자열을 CPU millicore / 메모리 MiB로 변환.
 * <p>
 * Parsing is permissive: empty input means "nothing declared" and yields 0, and a malformed
 * value also yields 0 after a warning, so one bad value never aborts a report.
 * Decimal suffixes (K, M, G, T) use the same 1024-based factors as the binary ones;
 * this is a known approximation kept for consistency with existing reports.
 */
@Component
public class QuantityParser {

    private static final Logger log = LoggerFactory.getLogger(QuantityParser.class);

    private static final double BYTES_PER_MIB = 1024.0 * 1024.0;

    private static final Pattern NUMBER = Pattern.compile("\\+?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * 접미사 -> MiB 배수. 두 글자 접미사를 먼저 검사한다.
     */
    static final Map<String, Double> MEMORY_MULTIPLIERS;

    static {
        Map<String, Double> multipliers = new LinkedHashMap<>();
        multipliers.put("Ki", 1.0 / 1024);
        multipliers.put("Mi", 1.0);
        multipliers.put("Gi", 1024.0);
        multipliers.put("Ti", 1024.0 * 1024);
        multipliers.put("K", 1.0 / 1024);
        multipliers.put("k", 1.0 / 1024);
        multipliers.put("M", 1.0);
        multipliers.put("G", 1024.0);
        multipliers.put("T", 1024.0 * 1024);
        MEMORY_MULTIPLIERS = Collections.unmodifiableMap(multipliers);
    }

    private final LongAdder failures = new LongAdder();

    /**
     * CPU quantity -> millicores. "250m" = 250, "0.5" = 500, empty = 0.
     */
    public double parseCpu(String value) {
        if (isBlank(value)) {
            return 0.0;
        }
        OptionalDouble parsed = tryParseCpu(value);
        if (parsed.isEmpty()) {
            recordFailure("cpu", value);
            return 0.0;
        }
        return parsed.getAsDouble();
    }

    /**
     * Memory quantity -> MiB. A number without suffix is read according to {@code convention}.
     */
    public double parseMemory(String value, BareNumberConvention convention) {
        if (isBlank(value)) {
            return 0.0;
        }
        OptionalDouble parsed = tryParseMemory(value, convention);
        if (parsed.isEmpty()) {
            recordFailure("memory", value);
            return 0.0;
        }
        return parsed.getAsDouble();
    }

    /**
     * 엄격한 CPU 파싱: 비어 있거나 잘못된 값이면 empty. 실패 카운트는 올리지 않는다.
     */
    public OptionalDouble tryParseCpu(String value) {
        if (isBlank(value)) {
            return OptionalDouble.empty();
        }
        String trimmed = value.trim();
        if (trimmed.endsWith("m")) {
            return parseNumber(trimmed.substring(0, trimmed.length() - 1));
        }
        OptionalDouble cores = parseNumber(trimmed);
        return cores.isPresent() ? finite(cores.getAsDouble() * 1000.0) : cores;
    }

    /**
     * 엄격한 메모리 파싱: 비어 있거나 잘못된 값이면 empty.
     */
    public OptionalDouble tryParseMemory(String value, BareNumberConvention convention) {
        if (isBlank(value)) {
            return OptionalDouble.empty();
        }
        String trimmed = value.trim();
        for (Map.Entry<String, Double> unit : MEMORY_MULTIPLIERS.entrySet()) {
            if (trimmed.endsWith(unit.getKey())) {
                OptionalDouble number = parseNumber(trimmed.substring(0, trimmed.length() - unit.getKey().length()));
                return number.isPresent() ? finite(number.getAsDouble() * unit.getValue()) : number;
            }
        }

        OptionalDouble bare = parseNumber(trimmed);
        if (bare.isEmpty() || convention == BareNumberConvention.MEBIBYTES) {
            return bare;
        }
        return OptionalDouble.of(bare.getAsDouble() / BYTES_PER_MIB);
    }

    /**
     * 파싱 실패 누적 횟수 (애플리케이션 기동 이후)
     */
    public long failureCount() {
        return failures.sum();
    }

    private void recordFailure(String resource, String value) {
        failures.increment();
        log.warn("Unparseable {} quantity '{}', counted as 0", resource, value);
    }

    private static OptionalDouble parseNumber(String text) {
        if (!NUMBER.matcher(text).matches()) {
            return OptionalDouble.empty();
        }
        double number = Double.parseDouble(text);
        return Double.isFinite(number) ? OptionalDouble.of(number) : OptionalDouble.empty();
    }

    // 단위 배수를 곱한 뒤에도 유한해야 한다 ("1e308Ti")
    private static OptionalDouble finite(double value) {
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
