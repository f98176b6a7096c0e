/**
 * Progression package: modular arithmetic over the packed value of an identifier.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ulid.core.progression.Progression} - forward/backward/next/previous</li>
 *   <li>{@link com.ryuqq.ulid.core.progression.IdentifierSequence} - lazy, restartable bounded sequences</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ULID Team
 */
package com.ryuqq.ulid.core.progression;
