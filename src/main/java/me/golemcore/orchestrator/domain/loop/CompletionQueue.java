package me.golemcore.orchestrator.domain.loop;

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

import me.golemcore.orchestrator.domain.model.Completion;
import me.golemcore.orchestrator.port.inbound.CompletionPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Lock-free hand-off of completions from any thread to the scheduler thread.
 */
@Component
public class CompletionQueue implements CompletionPort {

    private final Queue<Completion> queue = new ConcurrentLinkedQueue<>();

    @Override
    public void submit(Completion completion) {
        Objects.requireNonNull(completion, "completion");
        Objects.requireNonNull(completion.sessionId(), "completion.sessionId");
        Objects.requireNonNull(completion.kind(), "completion.kind");
        queue.add(completion);
    }

    /**
     * Removes and returns everything queued so far, in arrival order.
     */
    public List<Completion> drain() {
        List<Completion> drained = new ArrayList<>();
        Completion next;
        while ((next = queue.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    public int size() {
        return queue.size();
    }
}
