/**
 * SPI Contract Test 기반 클래스.
 *
 * <p>어댑터 모듈의 테스트가 상속해 SPI 계약 준수를 검증합니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
package com.ryuqq.ulid.testkit.contract;
