package com.sqlgrader.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FormatCheckReport {
    public enum Status {
        PASS,
        WARNING,
        FAIL
    }

    public static class Item {
        private final int questionIndex;
        private final Status status;
        private final String message;

        public Item(int questionIndex, Status status, String message) {
            this.questionIndex = questionIndex;
            this.status = status;
            this.message = message;
        }

        public int getQuestionIndex() {
            return questionIndex;
        }

        public Status getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }
    }

    private final String fileName;
    private final boolean validFileName;
    private final List<Item> items = new ArrayList<>();

    public FormatCheckReport(String fileName, boolean validFileName) {
        this.fileName = fileName;
        this.validFileName = validFileName;
    }

    public void add(int questionIndex, Status status, String message) {
        items.add(new Item(questionIndex, status, message));
    }

    public String getFileName() {
        return fileName;
    }

    public boolean isValidFileName() {
        return validFileName;
    }

    public List<Item> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean isPassed() {
        if (!validFileName) {
            return false;
        }
        for (Item item : items) {
            if (item.getStatus() == Status.FAIL) {
                return false;
            }
        }
        return true;
    }
}
