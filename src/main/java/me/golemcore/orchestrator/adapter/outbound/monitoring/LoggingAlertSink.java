package me.golemcore.orchestrator.adapter.outbound.monitoring;

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

import me.golemcore.orchestrator.domain.model.Alert;
import me.golemcore.orchestrator.port.outbound.AlertSinkPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Delivers alerts to the application log. Replace with a paging or chat
 * integration by providing another {@link AlertSinkPort} bean.
 */
@Component
@Slf4j
public class LoggingAlertSink implements AlertSinkPort {

    @Override
    public void alert(Alert alert) {
        log.warn("[Alert] type={} service={} message={}", alert.getAlertType(), alert.getService(),
                alert.getMessage());
    }
}
