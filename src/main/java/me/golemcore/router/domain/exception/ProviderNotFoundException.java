package me.golemcore.router.domain.exception;

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

import lombok.Getter;

/** Referenced provider is absent from the live registry (or disabled). */
@Getter
public class ProviderNotFoundException extends RouterException {

    private static final long serialVersionUID = 1L;

    private final String providerId;

    public ProviderNotFoundException(String providerId) {
        this(providerId, "Provider with ID " + providerId + " not found");
    }

    public ProviderNotFoundException(String providerId, String message) {
        super(RouterErrorCode.PROVIDER_NOT_FOUND, message);
        this.providerId = providerId;
    }
}
