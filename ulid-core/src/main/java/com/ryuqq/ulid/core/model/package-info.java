/**
 * Identifier model package.
 *
 * <p>Immutable value objects for the three identifier shapes:</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ulid.core.model.Ulid} - 128-bit identifier (48-bit timestamp + 80-bit randomness)</li>
 *   <li>{@link com.ryuqq.ulid.core.model.ShortUlid} - 56-bit identifier produced by the short env counter</li>
 *   <li>{@link com.ryuqq.ulid.core.model.Slid} - 64-bit compact identifier (48-bit timestamp + 16-bit randomness)</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> the packed byte array is copied in and out</li>
 *   <li><strong>Ordering:</strong> equality and ordering are unsigned comparison of the packed value</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ULID Team
 */
package com.ryuqq.ulid.core.model;
