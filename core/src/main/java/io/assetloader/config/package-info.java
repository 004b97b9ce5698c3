/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 加载配置 */
@ParametersAreNonnullByDefault
package io.assetloader.config;

import javax.annotation.ParametersAreNonnullByDefault;
