package com.ryuqq.asms.core.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * 동적 숫자 값의 확장/축소 변환.
 *
 * <p>Transport는 정수와 실수를 구분 없이 전달할 수 있으므로 (Integer, Long, Float, Double,
 * BigDecimal 등) 숫자 필드는 모든 {@link Number}를 받아들입니다. 스키마 검증과 각 Unit의
 * 옵션 파싱은 모두 이 클래스를 통해 변환합니다.</p>
 *
 * <p>축소 변환은 값을 잘라내지 않습니다. 대상 범위를 벗어나거나 NaN/무한대이면
 * {@link ArithmeticException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Numbers {

    // Utility class - prevent instantiation
    private Numbers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 숫자 값인지 확인.
     *
     * @param value 검사할 값
     * @return Number이면 true (Boolean은 제외)
     */
    public static boolean isNumeric(Object value) {
        return value instanceof Number;
    }

    /**
     * 유한한 숫자 값인지 확인 (NaN, 무한대는 false).
     *
     * @param value 검사할 값
     * @return 유한한 Number이면 true
     */
    public static boolean isFinite(Object value) {
        return value instanceof Number number && Double.isFinite(number.doubleValue());
    }

    /**
     * 실수로 확장.
     *
     * @param value 변환할 값
     * @return 숫자이면 double 값, 아니면 empty
     * @throws ArithmeticException NaN 또는 무한대인 경우
     */
    public static OptionalDouble toDouble(Object value) {
        if (!(value instanceof Number number)) {
            return OptionalDouble.empty();
        }
        double result = number.doubleValue();
        if (!Double.isFinite(result)) {
            throw new ArithmeticException("not a finite number: " + value);
        }
        return OptionalDouble.of(result);
    }

    /**
     * 정수로 축소 (실수는 소수점 이하 버림).
     *
     * @param value 변환할 값
     * @return 숫자이면 int 값, 아니면 empty
     * @throws ArithmeticException int 범위를 벗어나거나 유한하지 않은 경우
     */
    public static OptionalInt toInt(Object value) {
        OptionalLong wide = toLong(value);
        if (wide.isEmpty()) {
            return OptionalInt.empty();
        }
        long result = wide.getAsLong();
        if (result < Integer.MIN_VALUE || result > Integer.MAX_VALUE) {
            throw new ArithmeticException("integer out of range: " + value);
        }
        return OptionalInt.of((int) result);
    }

    /**
     * long으로 축소 (실수는 소수점 이하 버림).
     *
     * @param value 변환할 값
     * @return 숫자이면 long 값, 아니면 empty
     * @throws ArithmeticException long 범위를 벗어나거나 유한하지 않은 경우
     */
    public static OptionalLong toLong(Object value) {
        if (!(value instanceof Number number)) {
            return OptionalLong.empty();
        }
        if (number instanceof Long || number instanceof Integer
            || number instanceof Short || number instanceof Byte) {
            return OptionalLong.of(number.longValue());
        }
        if (number instanceof BigInteger big) {
            return OptionalLong.of(exactLong(big, value));
        }
        if (number instanceof BigDecimal decimal) {
            return OptionalLong.of(exactLong(decimal.toBigInteger(), value));
        }
        double result = number.doubleValue();
        // 2^63은 double로 정확히 표현되므로 상한은 미만 비교
        if (!Double.isFinite(result) || result < -0x1p63 || result >= 0x1p63) {
            throw new ArithmeticException("integer out of range: " + value);
        }
        return OptionalLong.of((long) result);
    }

    private static long exactLong(BigInteger big, Object original) {
        if (big.bitLength() > 63) {
            throw new ArithmeticException("integer out of range: " + original);
        }
        return big.longValue();
    }
}
