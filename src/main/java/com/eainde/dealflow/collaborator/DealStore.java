package com.eainde.dealflow.collaborator;

import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.MonitoringOutcome;
import com.eainde.dealflow.model.ProposalOutcome;
import com.eainde.dealflow.model.QualificationOutcome;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.SourceDocument;
import com.eainde.dealflow.model.StaffingAssignment;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of deals and run outcomes. The flows only read from it while
 * resolving inputs and write to it once a run has completed.
 */
public interface DealStore {

    Optional<Deal> findDeal(String dealId);

    /** All documents of the deal, processed or not, in creation order. */
    List<SourceDocument> documents(String dealId);

    Optional<SourceDocument> findDocument(String documentId);

    /** Requirements recorded by the latest qualification. */
    List<Requirement> requirements(String dealId);

    List<StaffingAssignment> assignments(String dealId);

    void saveQualification(String dealId, QualificationOutcome outcome);

    void saveProposal(String dealId, ProposalOutcome outcome);

    void saveMonitoring(String dealId, MonitoringOutcome outcome);
}
