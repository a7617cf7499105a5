package com.lumilang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lumilang.reader.form.Compound;
import com.lumilang.reader.form.Element;
import com.lumilang.reader.form.Form;
import com.lumilang.reader.form.FormVisitor;
import com.lumilang.reader.form.NumberAtom;
import com.lumilang.reader.form.SourceLocation;
import com.lumilang.reader.form.StringAtom;
import com.lumilang.reader.form.Symbol;
import com.lumilang.reader.parser.ParseException;

import java.util.List;

/**
 * Form 树转 JSON
 *
 * <pre>
 * {"type":"compound","elements":[
 *   {"type":"symbol","name":"f"},
 *   {"type":"number","value":1},
 *   {"type":"string","value":"s","splayed":true}]}
 * </pre>
 */
public class FormJson implements FormVisitor<JsonObject, Void> {

    private final boolean includeLocations;

    public FormJson(boolean includeLocations) {
        this.includeLocations = includeLocations;
    }

    public FormJson() {
        this(false);
    }

    public JsonObject toJson(Form form) {
        return form.accept(this, null);
    }

    public JsonArray toJson(List<Form> forms) {
        JsonArray array = new JsonArray();
        for (Form form : forms) {
            array.add(toJson(form));
        }
        return array;
    }

    /**
     * 语法错误的 JSON 表示
     */
    public static JsonObject error(ParseException e) {
        JsonObject error = new JsonObject();
        error.addProperty("kind", e.getKind().name());
        error.addProperty("message", e.getMessage());
        error.addProperty("line", e.getLine());
        error.addProperty("column", e.getColumn());
        error.addProperty("offset", e.getOffset());
        if (e.getExpected() != null) {
            error.addProperty("expected", e.getExpected());
        }
        return error;
    }

    @Override
    public JsonObject visitSymbol(Symbol node, Void ctx) {
        JsonObject json = node("symbol", node);
        json.addProperty("name", node.getName());
        return json;
    }

    @Override
    public JsonObject visitNumber(NumberAtom node, Void ctx) {
        JsonObject json = node("number", node);
        json.addProperty("value", node.getValue());
        return json;
    }

    @Override
    public JsonObject visitString(StringAtom node, Void ctx) {
        JsonObject json = node("string", node);
        json.addProperty("value", node.getValue());
        return json;
    }

    @Override
    public JsonObject visitCompound(Compound node, Void ctx) {
        JsonObject json = node("compound", node);
        JsonArray elements = new JsonArray();
        for (Element element : node.getElements()) {
            JsonObject child = element.getForm().accept(this, null);
            if (element.isSplayed()) {
                child.addProperty("splayed", true);
            }
            elements.add(child);
        }
        json.add("elements", elements);
        return json;
    }

    private JsonObject node(String type, Form form) {
        JsonObject json = new JsonObject();
        json.addProperty("type", type);
        if (includeLocations && form.getLocation().isKnown()) {
            SourceLocation loc = form.getLocation();
            json.addProperty("line", loc.getLine());
            json.addProperty("column", loc.getColumn());
            json.addProperty("offset", loc.getOffset());
            json.addProperty("length", loc.getLength());
        }
        return json;
    }
}
