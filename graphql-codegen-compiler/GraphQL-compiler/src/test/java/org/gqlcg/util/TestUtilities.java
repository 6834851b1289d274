package org.gqlcg.util;

import org.gqlcg.graphqlCompiler.compiler.errors.InternalCompilerError;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Test various utilities functions */
public class TestUtilities {
    @Test
    public void testHashString() {
        HashString hash = HashString.sha256("");
        Assert.assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", hash.value());
        Assert.assertEquals("e3b0c44298fc", hash.shortString());
        Assert.assertEquals(HashString.sha256("query"), HashString.sha256("query"));
    }

    @Test
    public void testIndentStream() {
        StringBuilder builder = new StringBuilder();
        IIndentStream stream = new IndentStream(builder);
        stream.append("a {").increase()
                .append("b").newline()
                .append("c").decrease().newline()
                .append("}");
        Assert.assertEquals("a {\n    b\n    c\n}", builder.toString());
    }

    @Test
    public void testIndentIsNotEmittedOnBlankLines() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder);
        stream.append("a").increase().newline().append("b").decrease();
        Assert.assertThrows(InternalCompilerError.class, stream::decrease);
        stream.resetIndent();
        stream.newline().append("c");
        Assert.assertEquals("a\n\n    b\nc", builder.toString());
    }

    @Test
    public void testPutNew() {
        Map<String, Integer> map = new HashMap<>();
        Utilities.putNew(map, "a", 1);
        Assert.assertThrows(InternalCompilerError.class, () -> Utilities.putNew(map, "a", 2));
        Assert.assertEquals(1, (int) map.get("a"));
    }

    @Test
    public void testLinq() {
        List<Integer> data = List.of(1, 2, 3, 4);
        Assert.assertEquals(List.of(2, 4), Linq.where(data, x -> x % 2 == 0));
        Assert.assertEquals(List.of("1", "2", "3", "4"), Linq.map(data, String::valueOf));
    }
}
