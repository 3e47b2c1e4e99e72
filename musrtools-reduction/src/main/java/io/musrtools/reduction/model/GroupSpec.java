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

import java.util.List;

/**
 * A named set of detector channels.
 *
 * @param name legal item name, see {@link ItemNames}
 * @param channelIds channel list text such as {@code "1-5,8"}
 */
public record GroupSpec(String name, String channelIds) {

    public GroupSpec {
        ItemNames.requireValid(name, "group");
        ChannelIdList.parse(channelIds);
    }

    /** @return the parsed channel identifiers, in written order */
    public List<Integer> channels() {
        return ChannelIdList.parse(channelIds);
    }
}
