/**
 * Fact gathering through a transport and a per-run cache.
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.application.fact;
