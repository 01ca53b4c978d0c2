/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.wrangler.transform;

/**
 * Reason a reversal was refused or failed.
 *
 * <ul>
 *   <li>{@link #NOT_REVERSIBLE} - the transformation is flagged irreversible</li>
 *   <li>{@link #UNKNOWN_TYPE} - no applier is registered for the type</li>
 *   <li>{@link #NO_RECORDED_APPLICATION} - the executor never applied this transformation</li>
 *   <li>{@link #FAILED} - the applier raised while reversing</li>
 * </ul>
 */
public enum ReversalError {

    NOT_REVERSIBLE,
    UNKNOWN_TYPE,
    NO_RECORDED_APPLICATION,
    FAILED
}
