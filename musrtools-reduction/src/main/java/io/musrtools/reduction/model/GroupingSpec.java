package io.musrtools.reduction.model;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.musrtools.reduction.ValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The declared groups and pairs of one analysis.
 *
 * <p>Construction checks the specification on its own terms: every name is
 * unique across groups and pairs, and every pair refers to declared groups.
 * Checks against actual data (channel coverage) belong to the orchestration stage.
 */
public final class GroupingSpec {

    private final List<GroupSpec> groups;
    private final List<PairSpec> pairs;

    public GroupingSpec(List<GroupSpec> groups, List<PairSpec> pairs) {
        this.groups = List.copyOf(Objects.requireNonNull(groups, "groups cannot be null"));
        this.pairs = List.copyOf(Objects.requireNonNull(pairs, "pairs cannot be null"));
        validate();
    }

    private void validate() {
        Set<String> names = new HashSet<>();
        for (GroupSpec group : groups) {
            if (!names.add(group.name())) {
                throw new ValidationException("Duplicate group name '" + group.name() + "'");
            }
        }
        for (PairSpec pair : pairs) {
            if (!names.add(pair.name())) {
                throw new ValidationException("Pair name '" + pair.name() + "' is already in use");
            }
            if (group(pair.forward()).isEmpty()) {
                throw new ValidationException("Pair '" + pair.name() + "' refers to undeclared group '" + pair.forward() + "'");
            }
            if (group(pair.backward()).isEmpty()) {
                throw new ValidationException("Pair '" + pair.name() + "' refers to undeclared group '" + pair.backward() + "'");
            }
        }
    }

    public List<GroupSpec> groups() {
        return groups;
    }

    public List<PairSpec> pairs() {
        return pairs;
    }

    public Optional<GroupSpec> group(String name) {
        return groups.stream().filter(g -> g.name().equals(name)).findFirst();
    }

    public Optional<PairSpec> pair(String name) {
        return pairs.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /** @return every channel id any group refers to, in first-seen order */
    public List<Integer> referencedChannels() {
        List<Integer> all = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (GroupSpec group : groups) {
            for (int id : group.channels()) {
                if (seen.add(id)) {
                    all.add(id);
                }
            }
        }
        return all;
    }

    @Override
    public String toString() {
        return "GroupingSpec{groups=" + groups.size() + ", pairs=" + pairs.size() + "}";
    }
}
