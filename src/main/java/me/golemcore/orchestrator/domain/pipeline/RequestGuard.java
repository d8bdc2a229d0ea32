package me.golemcore.orchestrator.domain.pipeline;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.orchestrator.domain.model.GuardResult;
import me.golemcore.orchestrator.domain.model.InboundRequest;

/**
 * One admission check in front of the turn pipeline.
 *
 * <p>
 * Guards run in {@link #getOrder()} order and the first rejection wins; later
 * guards are not consulted. A guard reports failure through its
 * {@link GuardResult}, never by throwing.
 *
 * @see RequestGuardChain
 */
public interface RequestGuard {

    String getName();

    int getOrder();

    GuardResult check(InboundRequest request);
}
