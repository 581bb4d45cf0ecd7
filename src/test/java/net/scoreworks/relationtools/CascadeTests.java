package net.scoreworks.relationtools;

import net.scoreworks.relationtools.storage.InMemoryRecordStore.Operation;
import net.scoreworks.test_model.Comment;
import net.scoreworks.test_model.FlakyRecordStore;
import net.scoreworks.test_model.Invoice;
import net.scoreworks.test_model.InvoiceLine;
import net.scoreworks.test_model.Payment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class CascadeTests {
    Persistence persistence = Persistence.getInstance();
    FlakyRecordStore store;
    Invoice invoice;

    @BeforeEach
    public void createInvoiceGraph() {
        store = new FlakyRecordStore();
        persistence.setStore(store);
        invoice = new Invoice("INV-1");
        invoice.setLines(List.of(new InvoiceLine("pen", 2), new InvoiceLine("ink", 1)));
        invoice.setPayments(List.of(new Payment(100)));
        invoice.setComments(List.of(new Comment("urgent")));
        Assertions.assertTrue(invoice.saveWithRelations(true));
        store.resetCalls();
    }
    @AfterEach
    public void cleanUp() {
        persistence.shutdown();
    }

    @Test
    public void testSaveWithRelationsPersistsGraphOfNewParent() {
        Assertions.assertEquals(1, store.size("invoice"));
        Assertions.assertEquals(2, store.size("invoiceLine"));
        Assertions.assertEquals(1, store.size("payment"));
        //assigned relations are saved even if they are not kept updated
        Assertions.assertEquals(1, store.size("comment"));
        for (InvoiceLine line : invoice.getLines()) {
            Assertions.assertEquals(invoice.getPrimaryKey(), line.getAttribute("invoiceId"));
        }
    }

    @Test
    public void testInvalidRelationPreventsAnySave() {
        List<InvoiceLine> lines = invoice.getLines();
        lines.get(0).setAttribute("name", "pencil");
        lines.get(1).setAttribute("quantity", -5);
        invoice.setLines(lines);
        invoice.setPayments(List.of(new Payment(20)));

        Assertions.assertFalse(invoice.saveRelations());
        Assertions.assertEquals(0, store.getCalls(Operation.INSERT));
        Assertions.assertEquals(0, store.getCalls(Operation.UPDATE));
        Assertions.assertEquals(0, store.getCalls(Operation.DELETE));

        Map<String, List<Map<String, List<String>>>> errors = invoice.getRelationsErrors();
        Assertions.assertEquals(List.of("lines"), List.copyOf(errors.keySet()));
        Assertions.assertTrue(errors.get("lines").get(0).containsKey("quantity"));
    }

    @Test
    public void testValidationGatingCanBeDisabled() {
        List<InvoiceLine> lines = invoice.getLines();
        lines.get(1).setAttribute("quantity", -5);
        invoice.setLines(lines);
        Assertions.assertTrue(invoice.saveRelations(false));
        Assertions.assertEquals(-5, ActiveRecord.findOne(InvoiceLine.class, lines.get(1).getPrimaryKey()).getAttribute("quantity"));
    }

    @Test
    public void testInvalidParentPreventsSaveWithRelations() {
        invoice.setAttribute("number", " ");
        Assertions.assertFalse(invoice.saveWithRelations(true));
        Assertions.assertEquals(0, store.getCalls(Operation.UPDATE));
        Assertions.assertEquals(List.of("Number cannot be blank."), invoice.getErrors().get("number"));
    }

    @Test
    public void testValidateRelationsCoversAllAssignedRelations() {
        Invoice draft = new Invoice("INV-2");
        Assertions.assertTrue(draft.validateRelations());
        draft.setLines(List.of(new InvoiceLine("", 1)));
        draft.setPayments(List.of(new Payment(1)));
        Assertions.assertFalse(draft.validateRelations());
        Assertions.assertEquals(1, draft.getRelationsErrors().size());
    }

    @Test
    public void testDeleteCascadesToRelationsKeptUpdated() {
        Invoice loaded = ActiveRecord.findOne(Invoice.class, invoice.getPrimaryKey());
        Assertions.assertTrue(loaded.delete());
        Assertions.assertTrue(loaded.isLastCascadeDeleteSuccessful());
        Assertions.assertEquals(0, store.size("invoice"));
        Assertions.assertEquals(0, store.size("invoiceLine"));
        Assertions.assertEquals(0, store.size("payment"));
        //comments are not kept updated
        Assertions.assertEquals(1, store.size("comment"));
    }

    @Test
    public void testFailingCascadeIsAdvisoryByDefault() {
        Invoice loaded = ActiveRecord.findOne(Invoice.class, invoice.getPrimaryKey());
        store.failOn("payment", loaded.getPayments().get(0).getPrimaryKey());
        Assertions.assertTrue(loaded.delete());
        Assertions.assertFalse(loaded.isLastCascadeDeleteSuccessful());
        Assertions.assertEquals(0, store.size("invoice"));
        Assertions.assertEquals(0, store.size("invoiceLine"));
    }

    @Test
    public void testFailingCascadeCanBlockDeletion() {
        Invoice loaded = ActiveRecord.findOne(Invoice.class, invoice.getPrimaryKey());
        loaded.setCascadeDeleteBlocking(true);
        store.failOn("payment", loaded.getPayments().get(0).getPrimaryKey());
        Assertions.assertFalse(loaded.delete());
        Assertions.assertEquals(1, store.size("invoice"));
        //children deleted before the failure stay deleted
        Assertions.assertEquals(0, store.size("invoiceLine"));
    }

    @Test
    public void testDeleteRelationsCoversAssignedRelations() {
        Assertions.assertTrue(invoice.deleteRelations());
        Assertions.assertEquals(0, store.size("invoiceLine"));
        Assertions.assertEquals(0, store.size("payment"));
        Assertions.assertEquals(0, store.size("comment"));
        Assertions.assertEquals(1, store.size("invoice"));
    }

    @Test
    public void testUnassignedRelationsAreNotCascaded() {
        Invoice loaded = ActiveRecord.findOne(Invoice.class, invoice.getPrimaryKey());
        loaded.getLines();
        Assertions.assertFalse(loaded.isRelationAssigned("lines"));
        Assertions.assertTrue(loaded.saveRelations());
        Assertions.assertTrue(loaded.deleteRelations());
        Assertions.assertEquals(2, store.size("invoiceLine"));
    }
}
