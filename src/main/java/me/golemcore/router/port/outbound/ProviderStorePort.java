package me.golemcore.router.port.outbound;

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

import me.golemcore.router.domain.model.ProviderDescriptor;

import java.util.List;

/**
 * Persistence for the provider catalog. Implementations store the whole
 * catalog at once; the registry serializes calls.
 */
public interface ProviderStorePort {

    /**
     * Load all persisted providers. Returns an empty list when nothing is
     * stored or the store cannot be read.
     */
    List<ProviderDescriptor> loadAll();

    /**
     * Replace the persisted catalog with {@code providers}.
     */
    void saveAll(List<ProviderDescriptor> providers);
}
