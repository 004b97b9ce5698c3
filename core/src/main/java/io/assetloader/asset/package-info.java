/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 资源管理与资源包加载 */
@ParametersAreNonnullByDefault
package io.assetloader.asset;

import javax.annotation.ParametersAreNonnullByDefault;
