/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */
package dev.mars.jobrelay.core.registry;

import dev.mars.jobrelay.api.ServerId;

/**
 * One server a disconnected session was removed from.
 *
 * @param serverId    The server
 * @param becameEmpty True if the session was the server's last subscriber
 */
public record SessionRemoval(ServerId serverId, boolean becameEmpty) {
}
