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
package dev.mars.jobrelay.api.channel;

import dev.mars.jobrelay.api.ServerId;

import java.time.Instant;

/**
 * One dedicated, listening connection owned by a single listener supervisor.
 *
 * A handle is never shared between supervisors and never used from two
 * threads at once.
 */
public interface ChannelHandle {

    /** Server this handle listens on. */
    ServerId serverId();

    /** Time the underlying connection was opened and the subscription confirmed. */
    Instant openedAt();

    /** True once the handle has been closed, either locally or by the server. */
    boolean isClosed();
}
