/**
 * 파일 기반 카운터 저장소 어댑터.
 *
 * <p>local_lexical 전략이 프로세스 재시작 후에도 카운터를 이어가도록
 * 마지막 값을 파일 하나에 보관합니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
package com.ryuqq.ulid.adapter.file;
