package net.scoreworks.relationtools;

import net.scoreworks.relationtools.storage.InMemoryRecordStore;
import net.scoreworks.test_model.Invoice;
import net.scoreworks.test_model.InvoiceLine;
import net.scoreworks.test_model.Payment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class CloneAndFilterTests {
    Persistence persistence = Persistence.getInstance();
    InMemoryRecordStore store;
    Invoice invoice;

    @BeforeEach
    public void createInvoiceGraph() {
        store = new InMemoryRecordStore();
        persistence.setStore(store);
        invoice = new Invoice("INV-1");
        invoice.setAttribute("customer", "ACME");
        InvoiceLine cancelled = new InvoiceLine("ink", 1);
        cancelled.setAttribute("status", "cancelled");
        invoice.setLines(List.of(new InvoiceLine("pen", 2), cancelled, new InvoiceLine("paper", 5)));
        invoice.setPayments(List.of(new Payment(100)));
        Assertions.assertTrue(invoice.saveWithRelations(true));
    }
    @AfterEach
    public void cleanUp() {
        persistence.shutdown();
    }

    @Test
    public void testCloneRelationCopiesAttributesWithoutIdentity() {
        List<Record> clones = invoice.cloneRelation("lines");
        List<InvoiceLine> lines = invoice.getLines();
        Assertions.assertEquals(3, clones.size());
        for (int i = 0; i < clones.size(); i++) {
            Record clone = clones.get(i);
            Assertions.assertNotSame(lines.get(i), clone);
            Assertions.assertNull(clone.getPrimaryKey());
            Assertions.assertTrue(clone.isNewRecord());
            Assertions.assertEquals(lines.get(i).getAttribute("name"), clone.getAttribute("name"));
            Assertions.assertEquals(lines.get(i).getAttribute("status"), clone.getAttribute("status"));
        }
        //nothing was persisted
        Assertions.assertEquals(3, store.size("invoiceLine"));
    }

    @Test
    public void testFilterRelationKeepsMatchingRecordsInOrder() {
        invoice.filterRelation("lines", Map.of("status", "active"));
        List<InvoiceLine> lines = invoice.getLines();
        Assertions.assertEquals(2, lines.size());
        Assertions.assertEquals("pen", lines.get(0).getName());
        Assertions.assertEquals("paper", lines.get(1).getName());
    }

    @Test
    public void testFilterRelationLeavesSnapshot() {
        Invoice loaded = ActiveRecord.findOne(Invoice.class, invoice.getPrimaryKey());
        loaded.setLines(loaded.getLines());
        loaded.filterRelation("lines", Map.of("status", "active", "quantity", 5));
        Assertions.assertEquals(1, loaded.getLines().size());
        Assertions.assertEquals(3, loaded.getRelatedSnapshot("lines").size());

        //filtered records are removed on save
        Assertions.assertTrue(loaded.saveRelations());
        Assertions.assertEquals(1, store.size("invoiceLine"));
    }

    @Test
    public void testFilterWithUnknownAttributeMatchesNothing() {
        invoice.filterRelation("lines", Map.of("colour", "red"));
        Assertions.assertTrue(invoice.getLines().isEmpty());
    }

    @Test
    public void testDeepClone() {
        Invoice clone = (Invoice) invoice.deepClone();
        Assertions.assertNotSame(invoice, clone);
        Assertions.assertNull(clone.getPrimaryKey());
        Assertions.assertEquals("INV-1", clone.getAttribute("number"));
        Assertions.assertEquals("ACME", clone.getAttribute("customer"));

        List<InvoiceLine> lines = clone.getLines();
        Assertions.assertEquals(3, lines.size());
        for (int i = 0; i < lines.size(); i++) {
            Assertions.assertNull(lines.get(i).getPrimaryKey());
            Assertions.assertEquals(invoice.getLines().get(i).getName(), lines.get(i).getName());
        }
        Assertions.assertEquals(1, clone.getPayments().size());
        Assertions.assertEquals(100L, clone.getPayments().get(0).getAttribute("amount"));
        //comments are not kept updated and therefore not cloned
        Assertions.assertFalse(clone.isRelationAssigned("comments"));

        //saving the clone persists a second graph
        Assertions.assertTrue(clone.saveWithRelations(true));
        Assertions.assertEquals(2, store.size("invoice"));
        Assertions.assertEquals(6, store.size("invoiceLine"));
        Assertions.assertEquals(2, store.size("payment"));
        Assertions.assertEquals(clone.getPrimaryKey(), clone.getLines().get(0).getAttribute("invoiceId"));
    }
}
