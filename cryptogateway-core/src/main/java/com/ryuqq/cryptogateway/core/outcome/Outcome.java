package com.ryuqq.cryptogateway.core.outcome;

import com.ryuqq.cryptogateway.core.error.ErrorContext;
import com.ryuqq.cryptogateway.core.error.HostStatus;

import java.util.function.Function;

/**
 * 게이트웨이 동작 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 결과 값 포함</li>
 *   <li>{@link Fail}: 실패, {@link ErrorContext} 포함</li>
 * </ul>
 *
 * <p>호스트 어댑터는 {@link #isOk()}를 호스트의 boolean 반환값으로, {@link #hostStatus()}를
 * last error로 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;Long&gt; result = gateway.acquireContext(ctx, "container", AcquireFlags.none());
 * if (result instanceof Ok&lt;Long&gt; ok) {
 *     long hProv = ok.value();
 * } else if (result instanceof Fail&lt;Long&gt; fail) {
 *     int lastError = fail.error().hostStatus().code();
 * }
 * </pre>
 *
 * @param <T> 결과 값 타입
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 호스트에 보고할 상태 코드.
     *
     * @return 성공이면 SUCCESS, 실패면 오류 코드
     */
    default HostStatus hostStatus() {
        if (this instanceof Fail<T> fail) {
            return fail.error().hostStatus();
        }
        return HostStatus.SUCCESS;
    }

    /**
     * 성공 값 변환.
     *
     * @param mapper 변환 함수
     * @param <R> 새 값 타입
     * @return 성공이면 변환된 Ok, 실패면 같은 오류의 Fail
     */
    default <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Ok<T> ok) {
            return Ok.of(mapper.apply(ok.value()));
        }
        return Fail.of(((Fail<T>) this).error());
    }

    /**
     * 성공 값 조회.
     *
     * @return 결과 값
     * @throws IllegalStateException 실패 결과인 경우
     */
    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new IllegalStateException("Outcome is a failure: " + ((Fail<T>) this).error().describe());
    }
}
