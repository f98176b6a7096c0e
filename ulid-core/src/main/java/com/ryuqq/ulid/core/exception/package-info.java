/**
 * Exception taxonomy of the ULID SDK.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ulid.core.exception.DecodeException} - malformed input to any conversion</li>
 *   <li>{@link com.ryuqq.ulid.core.exception.FatalInitializationException} - integrity gate failure or timestamp overflow</li>
 * </ul>
 *
 * <p>Counter overflow and progression overflow are not errors: they wrap silently.</p>
 *
 * @since 1.0.0
 * @author ULID Team
 */
package com.ryuqq.ulid.core.exception;
