/**
 * 시스템 무결성 검사.
 *
 * <p>식별자 생성 전에 비트 폭/바이트 순서/카운터 순환/시계/엔트로피 가정을 확인합니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
package com.ryuqq.ulid.core.integrity;
