package com.autoquant.resilience.core.model;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 원격 호출에 붙이는 상관관계(correlation) 태그.
 *
 * <p>로그와 예외 메시지에서 호출을 찾아내기 위한 값입니다. 코어는 태그 외에
 * Operation의 내용(브로커, 종목, 주문 등)을 알지 못합니다.</p>
 *
 * <p><strong>고유성:</strong> 태그는 고유할 필요가 없습니다. 작업 종류별로 하나의 태그를
 * 여러 동시 호출이 공유해도 됩니다({@code CallTag.of("submit-order")}).
 * 호출 하나를 구분해야 하는 곳(Half-Open probe 소유자 등)은 태그가 아니라
 * Circuit Breaker가 발급한 허가 객체를 사용합니다. 호출마다 다른 값이 필요하면
 * {@link #generate()}를 사용하세요.</p>
 *
 * <p>허용 형식: 1~{@value #MAX_LENGTH}자의 영숫자, 하이픈(-), 언더스코어(_).
 * 로그 한 줄을 깨뜨리지 않도록 공백과 제어 문자는 받지 않습니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class CallTag {

    public static final int MAX_LENGTH = 255;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]+");

    private final String value;

    private CallTag(String value) {
        this.value = value;
    }

    /**
     * 태그 생성.
     *
     * @param value 태그 값 (공유 가능)
     * @return CallTag
     * @throws IllegalArgumentException 형식에 맞지 않는 경우
     */
    public static CallTag of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CallTag cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "CallTag must be at most " + MAX_LENGTH + " characters (current: " + value.length() + ")");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "CallTag contains invalid characters, allowed: [A-Za-z0-9_-] (current: " + value + ")");
        }
        return new CallTag(value);
    }

    /**
     * 호출마다 다른 태그 생성 (UUID).
     *
     * @return 새 CallTag
     */
    public static CallTag generate() {
        return new CallTag(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallTag other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
