/**
 * YAML deploy files.
 *
 * <p>A deploy file is parsed into {@link com.ryuqq.fleet.cli.deploy.DeployStep} values
 * up front, so argument errors surface before evaluation starts. Step labels of the form
 * {@code file.yml#N} serve as call sites.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.cli.deploy;
