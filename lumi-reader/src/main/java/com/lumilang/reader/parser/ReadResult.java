package com.lumilang.reader.parser;

import com.lumilang.reader.form.Form;

import java.util.Collections;
import java.util.List;

/**
 * 一次读取调用的结果：全部顶层 Form，或一个语法错误（此时没有任何 Form）
 */
public final class ReadResult {
    private final List<Form> forms;
    private final ParseException error;

    private ReadResult(List<Form> forms, ParseException error) {
        this.forms = forms;
        this.error = error;
    }

    public static ReadResult success(List<Form> forms) {
        return new ReadResult(Collections.unmodifiableList(forms), null);
    }

    public static ReadResult failure(ParseException error) {
        return new ReadResult(Collections.<Form>emptyList(), error);
    }

    public List<Form> getForms() {
        return forms;
    }

    public ParseException getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }
}
