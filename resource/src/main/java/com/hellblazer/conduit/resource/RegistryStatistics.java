/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Conduit.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.conduit.resource;

import java.util.Map;

/**
 * Snapshot of registry occupancy
 *
 * @param liveByKind  live entries per kind, kinds without entries omitted
 * @param totalLive   live entries across all kinds
 * @param totalBound  entries ever bound
 * @param totalFreed  entries freed, explicitly or by teardown
 * @author hal.hildebrand
 */
public record RegistryStatistics(Map<HandleKind, Integer> liveByKind, int totalLive, long totalBound,
                                 long totalFreed) {

    public int live(HandleKind kind) {
        return liveByKind.getOrDefault(kind, 0);
    }

    public boolean isEmpty() {
        return totalLive == 0;
    }
}
