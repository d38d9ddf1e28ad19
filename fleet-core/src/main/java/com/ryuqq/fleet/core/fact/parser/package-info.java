/**
 * Pure parsers turning raw fact command output into structured values.
 *
 * <p>Parsers never touch a transport; they are tested against literal fixture
 * text. Unrecognised lines are skipped.</p>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.fact.parser;
