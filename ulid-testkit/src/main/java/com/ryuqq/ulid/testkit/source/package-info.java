/**
 * 결정적 테스트 더블 (시계, 엔트로피).
 *
 * @author ULID Team
 * @since 1.0.0
 */
package com.ryuqq.ulid.testkit.source;
