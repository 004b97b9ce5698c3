/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 并发上限控制 */
@ParametersAreNonnullByDefault
package io.assetloader.core.throttle;

import javax.annotation.ParametersAreNonnullByDefault;
