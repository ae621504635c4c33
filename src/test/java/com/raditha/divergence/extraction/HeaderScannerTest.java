package com.raditha.divergence.extraction;

import com.raditha.divergence.model.HeaderDescriptor;
import com.raditha.divergence.model.PassScope;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeaderScannerTest {

    private final HeaderScanner legacy = new HeaderScanner(HeaderDialect.LEGACY);
    private final HeaderScanner newPm = new HeaderScanner(HeaderDialect.NEW_PM);

    @Test
    void testLegacyNameIsLastParenthesizedGroup() {
        HeaderDescriptor header = legacy.recognize(
                "*** IR Dump After Instrument function entry/exit (post inlining) (post-inline-ee-instrument) ***", 4);

        assertNotNull(header);
        assertEquals("post-inline-ee-instrument", header.canonicalName());
        assertEquals(PassScope.UNKNOWN, header.scope());
        assertNull(header.target());
        assertEquals(4, header.lineNumber());
    }

    @Test
    void testLegacyWithoutParenthesesUsesWholeText() {
        HeaderDescriptor header = legacy.recognize("*** IR Dump After InstCombine ***", 1);
        assertNotNull(header);
        assertEquals("InstCombine", header.canonicalName());
    }

    @Test
    void testLegacyToleratesMarkerIndentAndColon() {
        HeaderDescriptor header = legacy.recognize("   # *** IR Dump After Early CSE (early-cse) ***:   ", 9);
        assertNotNull(header);
        assertEquals("early-cse", header.canonicalName());
        assertEquals("   # *** IR Dump After Early CSE (early-cse) ***:", header.originalLine());
    }

    @Test
    void testNewPmFunctionScope() {
        HeaderDescriptor header = newPm.recognize("; *** IR Dump After EarlyCSEPass on main ***", 2);
        assertNotNull(header);
        assertEquals("EarlyCSEPass", header.canonicalName());
        assertEquals(PassScope.FUNCTION, header.scope());
        assertEquals("main", header.target());
    }

    @Test
    void testNewPmModuleMarker() {
        HeaderDescriptor header = newPm.recognize("  ; *** IR Dump After VerifierPass on [module] ***", 1);
        assertNotNull(header);
        assertEquals("VerifierPass", header.canonicalName());
        assertEquals(PassScope.MODULE, header.scope());
        assertNull(header.target());
    }

    @Test
    void testDialectsDoNotRecognizeEachOther() {
        assertNull(legacy.recognize("; *** IR Dump After EarlyCSEPass on main ***", 1));
        assertNull(newPm.recognize("*** IR Dump After Early CSE (early-cse) ***", 1));
    }

    @Test
    void testContentLinesAreNotHeaders() {
        List<String> lines = List.of(
                "define i32 @main() {",
                "entry:",
                "*** IR Dump After Early CSE (early-cse) ***",
                "  ret i32 0",
                "; *** not a banner ***",
                "*** IR Dump After Simplify the CFG (simplifycfg) ***",
                "}");

        List<HeaderDescriptor> headers = legacy.scanHeaders(lines);

        assertEquals(2, headers.size());
        assertEquals("early-cse", headers.get(0).canonicalName());
        assertEquals(3, headers.get(0).lineNumber());
        assertEquals("simplifycfg", headers.get(1).canonicalName());
        assertEquals(6, headers.get(1).lineNumber());
    }

    @Test
    void testReaderAndListScansAgree() throws IOException {
        String dump = String.join("\n",
                "; ModuleID = 'test.c'",
                "; *** IR Dump After InstCombinePass on foo ***",
                "define void @foo() {",
                "  ret void",
                "}",
                "; *** IR Dump After GlobalDCEPass on [module] ***",
                "");

        List<HeaderDescriptor> fromReader = newPm.scanHeaders(new BufferedReader(new StringReader(dump)));
        List<HeaderDescriptor> fromList = newPm.scanHeaders(dump.lines().toList());

        assertEquals(fromList, fromReader);
        assertEquals(List.of(2, 6), fromReader.stream().map(HeaderDescriptor::lineNumber).toList());
    }

    @Test
    void testEmptyInput() {
        assertTrue(legacy.scanHeaders(List.of()).isEmpty());
    }

    @Test
    void testDialectFromString() {
        assertEquals(HeaderDialect.LEGACY, HeaderDialect.fromString("Legacy"));
        assertEquals(HeaderDialect.NEW_PM, HeaderDialect.fromString("new-pm"));
        assertEquals(HeaderDialect.NEW_PM, HeaderDialect.fromString("npm"));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> HeaderDialect.fromString("gcc"));
        assertTrue(ex.getMessage().contains("Invalid header dialect"));
    }
}
