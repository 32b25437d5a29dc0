package com.eainde.dealflow.collaborator;

import com.eainde.dealflow.model.Communication;
import com.eainde.dealflow.model.Deal;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link CommunicationSource} fed by the application itself, used when no
 * mailbox integration is configured.
 */
public class InMemoryCommunicationSource implements CommunicationSource {

    private final Map<String, List<Communication>> byDeal = new ConcurrentHashMap<>();

    public InMemoryCommunicationSource add(String dealId, Communication communication) {
        byDeal.computeIfAbsent(dealId, k -> new CopyOnWriteArrayList<>()).add(communication);
        return this;
    }

    @Override
    public List<Communication> recent(Deal deal) {
        return List.copyOf(byDeal.getOrDefault(deal.id(), List.of()));
    }
}
