package world.willfrog.review.content;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DocumentTypeFilterTest {

    private final DocumentTypeFilter filter = new DocumentTypeFilter();

    @Test
    void denyReason_shouldAllowUntypedDocuments() {
        assertNull(filter.denyReason(null));
        assertNull(filter.denyReason("  "));
    }

    @Test
    void denyReason_shouldAllowCoreAssessmentAndOfficerDocuments() {
        assertNull(filter.denyReason("Design and Access Statement"));
        assertNull(filter.denyReason("TRANSPORT ASSESSMENT"));
        assertNull(filter.denyReason("Delegated Report"));
    }

    @Test
    void denyReason_shouldPreferAllowListOverPublicCommentMatch() {
        assertNull(filter.denyReason("Consultation Response - Highway Authority"));
    }

    @Test
    void denyReason_shouldRejectPublicComments() {
        assertEquals("Public comment - not relevant for policy review", filter.denyReason("Letter of Objection"));
        assertEquals("Public comment - not relevant for policy review", filter.denyReason("Public Comment"));
    }

    @Test
    void denyReason_shouldAllowUnknownTypes() {
        assertNull(filter.denyReason("Supporting Photographs"));
    }

    @Test
    void filter_shouldTagFilteredDocumentsWithReason() {
        DocumentFilterResult result = filter.filter("25/01234/F", List.of(
                Map.of("document_id", "d1", "document_type", "Site Plan"),
                Map.of("document_id", "d2", "document_type", "Petition")));

        assertEquals(1, result.selected().size());
        assertEquals("d1", result.selected().get(0).get("document_id"));
        assertEquals(1, result.filteredOut().size());
        assertEquals("Public comment - not relevant for policy review", result.filteredOut().get(0).get("filter_reason"));
    }
}
