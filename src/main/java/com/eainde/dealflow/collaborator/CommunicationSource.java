package com.eainde.dealflow.collaborator;

import com.eainde.dealflow.model.Communication;
import com.eainde.dealflow.model.Deal;

import java.util.List;

/**
 * Recent client communications (mailbox, messaging) for a deal, in any order.
 */
public interface CommunicationSource {

    List<Communication> recent(Deal deal);
}
