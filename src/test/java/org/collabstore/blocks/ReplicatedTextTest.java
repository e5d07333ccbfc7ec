package org.collabstore.blocks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.collabstore.field.Splice;
import org.collabstore.field.TextChangePart;
import org.collabstore.field.TextField;
import org.collabstore.field.TextPatch;
import org.jgroups.Global;

import java.util.ArrayList;
import java.util.List;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * @since 1.0
 */
@Test(groups=Global.FUNCTIONAL, singleThreaded=true)
public class ReplicatedTextTest {
    protected final TextField field=new TextField();
    protected ReplicatedText  a, b;

    @BeforeMethod
    protected void init() {
        a=new ReplicatedText(field, 1);
        b=new ReplicatedText(field, 2);
    }

    public void testEmpty() {
        assertThat(a.value()).isEmpty();
        assertThat(a.isEmpty()).isTrue();
        assertThat(a.size()).isZero();
        assertThat(a.version()).isZero();
        assertThat(a.storeId()).isEqualTo(1);
        assertThat(a.field()).isSameAs(field);
    }

    public void testLocalEdits() {
        a.insert(0, "hello");
        a.insert(0, "");
        a.insert(5, " world");
        assertThat(a.value()).isEqualTo("hello world");
        a.remove(0, 6);
        assertThat(a.value()).isEqualTo("world");
        a.splice(0, 1, "W");
        assertThat(a.value()).isEqualTo("World");
        a.assign("new text");
        assertThat(a.value()).isEqualTo("new text");
        assertThat(a.version()).isEqualTo(6);
        a.clear();
        assertThat(a.isEmpty()).isTrue();
    }

    public void testBatchUpdateUsesOneVersion() {
        TextPatch patch=a.update(List.of(Splice.insert(0, "abc"), new Splice(1, 1, "de")));
        assertThat(a.value()).isEqualTo("adec");
        assertThat(a.version()).isEqualTo(1);
        assertThat(patch.size()).isEqualTo(2);
        patch.forEach(part -> part.insertedIds().forEach(id -> assertThat(id.clock()).isEqualTo(1)));
    }

    public void testCharAt() {
        a.assign("abc");
        assertThat(a.charAt(0)).isEqualTo('a');
        assertThat(a.charAt(2)).isEqualTo('c');
        assertThat(a.charAt(-1)).isEqualTo('c');
        assertThat(a.charAt(-3)).isEqualTo('a');
        assertThatThrownBy(() -> a.charAt(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> a.charAt(-4)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    public void testSlice() {
        a.assign("abcdef");
        assertThat(a.slice(1, 3)).isEqualTo("bc");
        assertThat(a.slice(-2, 100)).isEqualTo("ef");
        assertThat(a.slice(-100, 2)).isEqualTo("ab");
        assertThat(a.slice(4, 2)).isEmpty();
        assertThat(a.slice(0, -1)).isEqualTo("abcde");
    }

    public void testPatchExchange() {
        TextPatch p1=a.insert(0, "ab");
        b.apply(p1);
        assertThat(b.value()).isEqualTo("ab");

        TextPatch pa=a.insert(1, "X");
        TextPatch pb=b.remove(0, 1);
        a.apply(pb);
        b.apply(pa);
        assertThat(a.value()).isEqualTo(b.value()).isEqualTo("Xb");
        assertThat(a.tombstones()).isZero();
        assertThat(b.tombstones()).isZero();
    }

    public void testListeners() {
        List<List<TextChangePart>> changes=new ArrayList<>();
        List<TextPatch> patches=new ArrayList<>();
        ReplicatedText.Listener l=(text, change, patch) -> {
            assertThat(text).isSameAs(b);
            changes.add(change);
            patches.add(patch);
        };
        b.addListener(l);

        TextPatch local=b.insert(0, "xy");
        assertThat(changes).containsExactly(List.of(new TextChangePart(0, "", "xy")));
        assertThat(patches).containsExactly(local);

        b.insert(0, "");   // empty change, no notification
        assertThat(changes).hasSize(1);

        b.apply(a.insert(0, "a"));
        assertThat(changes).hasSize(2);
        assertThat(changes.get(1)).hasSize(1);
        assertThat(changes.get(1).get(0).inserted()).isEqualTo("a");
        assertThat(b.value()).hasSize(3).contains("xy", "a");
        assertThat(patches.get(1)).isNull();

        b.apply(a.insert(0, "q"));
        assertThat(changes).hasSize(3);
        b.removeListener(l);
        b.insert(0, "z");
        assertThat(changes).hasSize(3);
    }

    public void testInvalidStoreId() {
        assertThatThrownBy(() -> new ReplicatedText(field, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReplicatedText(null, 1)).isInstanceOf(NullPointerException.class);
    }
}
