package me.golemcore.worklog.port.outbound;

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

import me.golemcore.worklog.domain.model.PullRequestSnapshot;
import me.golemcore.worklog.domain.model.TicketSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Port for pull request and ticket data held by a remote tracker. Optional:
 * callers skip it when disabled and treat {@link RemoteWorkException} as a
 * warning.
 */
public interface RemoteWorkPort {

    boolean isAvailable();

    List<PullRequestSnapshot> listMyOpenPullRequests();

    List<PullRequestSnapshot> listMyMergedPullRequestsSince(Instant since);

    /**
     * Look up a ticket by id. Empty when the tracker does not know the id or
     * cannot resolve ids of that form.
     */
    Optional<TicketSnapshot> findTicket(String id);
}
