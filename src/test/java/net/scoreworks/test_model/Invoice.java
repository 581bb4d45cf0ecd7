package net.scoreworks.test_model;

import net.scoreworks.relationtools.RelationalRecord;
import net.scoreworks.relationtools.annotations.HasMany;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

@HasMany(name = "lines", child = InvoiceLine.class, foreignKey = "invoiceId")
@HasMany(name = "payments", child = Payment.class, foreignKey = "invoiceId")
@HasMany(name = "comments", child = Comment.class, foreignKey = "invoiceId", keepUpdated = false)
public class Invoice extends RelationalRecord {

    public Invoice() {}

    public Invoice(String number) {
        setAttribute("number", number);
    }

    @Override
    public List<String> attributes() {
        return List.of("id", "number", "customer");
    }

    @Override
    protected void validateAttribute(String attribute, Object value) {
        if (attribute.equals("number") && StringUtils.isBlank((String) value))
            addError(attribute, "Number cannot be blank.");
    }

    public List<InvoiceLine> getLines() {
        return getRelated("lines");
    }

    public void setLines(List<InvoiceLine> lines) {
        setRelated("lines", lines);
    }

    public List<Payment> getPayments() {
        return getRelated("payments");
    }

    public void setPayments(List<Payment> payments) {
        setRelated("payments", payments);
    }

    public List<Comment> getComments() {
        return getRelated("comments");
    }

    public void setComments(List<Comment> comments) {
        setRelated("comments", comments);
    }
}
