package com.lumilang.reader.printer;

import com.lumilang.reader.Syntax;
import com.lumilang.reader.form.Compound;
import com.lumilang.reader.form.Element;
import com.lumilang.reader.form.Form;
import com.lumilang.reader.form.NumberAtom;
import com.lumilang.reader.form.StringAtom;
import com.lumilang.reader.form.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FormPrinter 单元测试
 */
class FormPrinterTest {

    private final FormPrinter printer = new FormPrinter();

    private String print(Form form) {
        return printer.print(form);
    }

    private String canonical(Form form) {
        return printer.print(form, PrintConfig.canonical());
    }

    private static Symbol sym(String name) {
        return new Symbol(name);
    }

    private static StringAtom str(String value) {
        return new StringAtom(value);
    }

    private static Compound call(String head, Form... args) {
        return Compound.call(head, args);
    }

    private static Compound list(Element... elements) {
        return new Compound(Arrays.asList(elements));
    }

    // ================================================================
    // 原子
    // ================================================================

    @Nested
    @DisplayName("原子")
    class AtomTests {

        @Test
        @DisplayName("符号和整数")
        void testSymbolAndInteger() {
            assertEquals("foo-bar?", print(sym("foo-bar?")));
            assertEquals("-3", print(new NumberAtom(-3)));
            assertEquals("9223372036854775807", print(new NumberAtom(Long.MAX_VALUE)));
        }

        @Test
        @DisplayName("浮点数保留小数点或指数")
        void testFloat() {
            assertEquals("2.5", print(new NumberAtom(2.5)));
            assertEquals("1.0", print(new NumberAtom(1.0)));
            assertEquals("1.0E20", print(new NumberAtom(1e20)));
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscapes() {
            assertEquals("\"a\\\"b\\\\c\\nd\\te\"", print(str("a\"b\\c\nd\te")));
            assertEquals("\"\\0\\r\"", print(str("\0\r")));
            assertEquals("\"\"", print(str("")));
        }

        @Test
        @DisplayName("字符串中的花括号加倍")
        void testBracesDoubled() {
            assertEquals("\"a {{x}} b\"", print(str("a {x} b")));
        }
    }

    // ================================================================
    // 缩写收缩
    // ================================================================

    @Nested
    @DisplayName("缩写收缩")
    class ContractionTests {

        @Test
        @DisplayName("前缀符号")
        void testSigils() {
            assertEquals("'x", print(call("quote", sym("x"))));
            assertEquals("`x", print(call("backquote", sym("x"))));
            assertEquals("~x", print(call("unquote", sym("x"))));
            assertEquals("..x", print(call("splay", sym("x"))));
            assertEquals("@x", print(call("atsign", sym("x"))));
            assertEquals(".x", print(call("met-name", sym("x"))));
        }

        @Test
        @DisplayName("嵌套前缀符号")
        void testNestedSigils() {
            assertEquals("'`~x", print(call("quote", call("backquote", call("unquote", sym("x"))))));
            assertEquals("'(a ~b)", print(call("quote", Compound.of(sym("a"), call("unquote", sym("b"))))));
        }

        @Test
        @DisplayName("访问")
        void testAccess() {
            assertEquals("[coll key]", print(call("access", sym("coll"), sym("key"))));
            assertEquals("[ar m : n]", print(call("access", sym("ar"), sym("m"), sym(":"), sym("n"))));
            assertEquals("[a ..b]", print(list(Element.of(sym("access")), Element.of(sym("a")),
                    Element.splayed(sym("b")))));
        }

        @Test
        @DisplayName("模板字符串")
        void testTemplate() {
            assertEquals("\"a {b} c\"", print(call("template-str", str("a "), sym("b"), str(" c"))));
            assertEquals("\"{a}{b}\"", print(call("template-str", str(""), sym("a"), str(""), sym("b"), str(""))));
            assertEquals("\"{{{x}}}\"", print(call("template-str", str("{"), sym("x"), str("}"))));
        }

        @Test
        @DisplayName("嵌入字符串和嵌套模板")
        void testEmbeddedStrings() {
            assertEquals("\"a{\"x\"}b\"", print(call("template-str", str("a"), str("x"), str("b"))));
            assertEquals("\"x{\"y{z}\"}\"",
                    print(call("template-str", str("x"), call("template-str", str("y"), sym("z"), str("")), str(""))));
        }

        @Test
        @DisplayName("空列表")
        void testEmptyList() {
            assertEquals("()", print(new Compound(Arrays.<Element>asList())));
        }
    }

    // ================================================================
    // 形状不符时保持调用形式
    // ================================================================

    @Nested
    @DisplayName("形状检查")
    class ArityTests {

        @Test
        @DisplayName("前缀符号需要恰好一个参数")
        void testSigilArity() {
            assertEquals("(quote x y)", print(call("quote", sym("x"), sym("y"))));
            assertEquals("(quote)", print(call("quote")));
            assertEquals("(quote ..x)", print(list(Element.of(sym("quote")), Element.splayed(sym("x")))));
        }

        @Test
        @DisplayName("访问需要至少两个参数")
        void testAccessArity() {
            assertEquals("(access a)", print(call("access", sym("a"))));
            assertEquals("(access)", print(call("access")));
        }

        @Test
        @DisplayName("模板需要交替的分段与 Form")
        void testTemplateShape() {
            assertEquals("(template-str \"a\" b)", print(call("template-str", str("a"), sym("b"))));
            assertEquals("(template-str a b c)", print(call("template-str", sym("a"), sym("b"), sym("c"))));
        }

        @Test
        @DisplayName("单分段模板与普通字符串输出相同")
        void testSingleSegmentTemplate() {
            assertEquals(print(str("abc")), print(call("template-str", str("abc"))));
            assertEquals("\"a{{b}}\\n\"", print(call("template-str", str("a{b}\n"))));
            assertEquals("(template-str)", print(call("template-str")));
            assertEquals("(template-str x)", print(call("template-str", sym("x"))));
            assertEquals("(template-str ..\"a\")",
                    print(list(Element.of(sym("template-str")), Element.splayed(str("a")))));
        }

        @Test
        @DisplayName("首元素带展开标记时不收缩")
        void testSplayedHead() {
            assertEquals("(..quote x)", print(list(Element.splayed(sym("quote")), Element.of(sym("x")))));
        }
    }

    // ================================================================
    // splay
    // ================================================================

    @Nested
    @DisplayName("splay")
    class SplayTests {

        @Test
        @DisplayName("展开标记输出为 ..x")
        void testFlag() {
            assertEquals("(f a ..b)", print(list(Element.of(sym("f")), Element.of(sym("a")), Element.splayed(sym("b")))));
        }

        @Test
        @DisplayName("参数列表中未标记的 (splay x) 保持调用形式")
        void testUnflaggedSplayCall() {
            assertEquals("(f (splay b))", print(call("f", call("splay", sym("b")))));
            assertEquals("[a (splay b)]", print(call("access", sym("a"), call("splay", sym("b")))));
        }

        @Test
        @DisplayName("其他位置的 (splay x) 收缩")
        void testSplayElsewhere() {
            assertEquals("'..x", print(call("quote", call("splay", sym("x")))));
            assertEquals("\"{..x}\"", print(call("template-str", str(""), call("splay", sym("x")), str(""))));
        }

        @Test
        @DisplayName("带标记的 (splay x)")
        void testFlaggedSplayCall() {
            assertEquals("(f ....x)", print(list(Element.of(sym("f")), Element.splayed(call("splay", sym("x"))))));
        }

        @Test
        @DisplayName(". 后面紧跟点号时插入空格")
        void testMetNameSpacing() {
            assertEquals(". .x", print(call("met-name", call("met-name", sym("x")))));
            assertEquals(". ..x", print(call("met-name", call("splay", sym("x")))));
            assertEquals("...x", print(call("splay", call("met-name", sym("x")))));
            assertEquals("@.x", print(call("atsign", call("met-name", sym("x")))));
        }
    }

    // ================================================================
    // 规范模式
    // ================================================================

    @Nested
    @DisplayName("规范模式")
    class CanonicalTests {

        @Test
        @DisplayName("所有缩写输出为调用形式")
        void testCanonical() {
            assertEquals("(quote x)", canonical(Syntax.read("'x")));
            assertEquals("(access a (quote b) ..c)", canonical(Syntax.read("[a 'b ..c]")));
            assertEquals("(template-str \"a\" b \"c\")", canonical(Syntax.read("\"a{b}c\"")));
            assertEquals("(splay x)", canonical(Syntax.read("..x")));
            assertEquals("((met-name m) ob)", canonical(Syntax.read("(.m ob)")));
        }

        @Test
        @DisplayName("Syntax.printCanonical")
        void testSyntaxEntryPoint() {
            assertEquals("(backquote (unquote x))", Syntax.printCanonical(Syntax.read("`~x")));
        }
    }

    // ================================================================
    // 深度限制
    // ================================================================

    @Nested
    @DisplayName("深度限制")
    class DepthTests {

        private Form nested(int depth) {
            Form form = sym("x");
            for (int i = 0; i < depth; i++) {
                form = Compound.of(form);
            }
            return form;
        }

        @Test
        @DisplayName("超过最大深度时抛出 IllegalStateException")
        void testMaxDepth() {
            PrintConfig config = new PrintConfig();
            config.setMaxDepth(5);
            assertEquals("(((((x)))))", printer.print(nested(5), config));
            assertThrows(IllegalStateException.class, () -> printer.print(nested(6), config));
        }

        @Test
        @DisplayName("默认深度限制")
        void testDefaultLimit() {
            assertThrows(IllegalStateException.class, () -> print(nested(PrintConfig.DEFAULT_MAX_DEPTH + 1)));
        }

        @Test
        @DisplayName("非法的最大深度")
        void testInvalidMaxDepth() {
            assertThrows(IllegalArgumentException.class, () -> new PrintConfig().setMaxDepth(0));
        }
    }
}
