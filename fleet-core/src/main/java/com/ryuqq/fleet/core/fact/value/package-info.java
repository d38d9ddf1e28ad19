/**
 * Structured values produced by the built-in fact parsers.
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.fact.value;
