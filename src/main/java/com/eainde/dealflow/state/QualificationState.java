package com.eainde.dealflow.state;

import com.eainde.dealflow.model.CapabilityRecord;
import com.eainde.dealflow.model.DealEntities;
import com.eainde.dealflow.model.DocumentRef;
import com.eainde.dealflow.model.GapAnalysis;
import com.eainde.dealflow.model.OrganizationProfile;
import com.eainde.dealflow.model.QualificationDecision;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.RoleMatch;

import java.util.List;
import java.util.Map;

public class QualificationState extends DealState {

    // Input
    public static final String DOCUMENT_TEXT = "documentText";
    public static final String DOCUMENTS = "documents";
    public static final String ROSTER = "roster";
    public static final String PROFILE = "organizationProfile";

    // ingest
    public static final String WORD_COUNT = "wordCount";
    public static final String CHAR_COUNT = "charCount";
    public static final String DOCUMENT_COUNT = "documentCount";

    // extract
    public static final String REQUIREMENTS = "requirements";
    public static final String ENTITIES = "entities";

    // analyze, match
    public static final String GAP_ANALYSIS = "gapAnalysis";
    public static final String ROLE_MATCHES = "roleMatches";

    // decide
    public static final String DECISION = "decision";

    public QualificationState(Map<String, Object> initData) {
        super(initData);
    }

    public String getDocumentText() {
        return stringOf(DOCUMENT_TEXT);
    }

    public List<DocumentRef> getDocuments() {
        return listOf(DOCUMENTS);
    }

    public List<CapabilityRecord> getRoster() {
        return listOf(ROSTER);
    }

    public OrganizationProfile getProfile() {
        return this.<OrganizationProfile>value(PROFILE).orElse(OrganizationProfile.empty());
    }

    public int getWordCount() {
        return intOf(WORD_COUNT, 0);
    }

    public int getCharCount() {
        return intOf(CHAR_COUNT, 0);
    }

    public int getDocumentCount() {
        return intOf(DOCUMENT_COUNT, 0);
    }

    public List<Requirement> getRequirements() {
        return listOf(REQUIREMENTS);
    }

    public DealEntities getEntities() {
        return this.<DealEntities>value(ENTITIES).orElse(DealEntities.empty());
    }

    public GapAnalysis getGapAnalysis() {
        return this.<GapAnalysis>value(GAP_ANALYSIS).orElse(GapAnalysis.unavailable("Gap analysis not run"));
    }

    public List<RoleMatch> getRoleMatches() {
        return listOf(ROLE_MATCHES);
    }

    public QualificationDecision getDecision() {
        return this.<QualificationDecision>value(DECISION).orElse(QualificationDecision.undecided("Decision not run"));
    }
}
