package net.scoreworks.test_model;

import net.scoreworks.relationtools.ActiveRecord;

import java.util.List;

public class Comment extends ActiveRecord {

    public Comment() {}

    public Comment(String text) {
        setAttribute("text", text);
    }

    @Override
    public List<String> attributes() {
        return List.of("id", "invoiceId", "text");
    }
}
