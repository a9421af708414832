package com.codescout.core.review;

import com.codescout.core.CodescoutException;

class ReviewCancelledException extends CodescoutException {

    ReviewCancelledException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "cancelled";
    }
}
