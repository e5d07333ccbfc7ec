package org.collabstore.crdt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.jgroups.Global;

import java.util.List;

import org.testng.annotations.Test;

/**
 * @since 1.0
 */
@Test(groups=Global.FUNCTIONAL, singleThreaded=true)
public class IdentifierListTest {

    public void testEmpty() {
        IdentifierList list=new IdentifierList();
        assertThat(list).isEmpty();
        assertThat(list.search(id(1))).isEqualTo(-1);
        assertThat(list.firstDisorder()).isEqualTo(-1);
        assertThatThrownBy(() -> list.get(0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    public void testSpliceInsertAndRemove() {
        IdentifierList list=new IdentifierList(2);
        list.splice(0, 0, new Identifier[]{id(10), id(40)});
        list.splice(1, 0, new Identifier[]{id(20), id(30)});
        assertThat(list).containsExactly(id(10), id(20), id(30), id(40));

        Identifier[] removed=list.splice(1, 2, new Identifier[]{id(25)});
        assertThat(removed).containsExactly(id(20), id(30));
        assertThat(list).containsExactly(id(10), id(25), id(40));

        removed=list.splice(0, 3, new Identifier[0]);
        assertThat(removed).hasSize(3);
        assertThat(list).isEmpty();
    }

    public void testGrowth() {
        IdentifierList list=new IdentifierList(1);
        for(int i=0; i < 100; i++)
            list.splice(i, 0, new Identifier[]{id(i + 1)});
        assertThat(list).hasSize(100);
        assertThat(list.get(99)).isEqualTo(id(100));
        assertThat(list.firstDisorder()).isEqualTo(-1);
    }

    public void testSearch() {
        IdentifierList list=new IdentifierList(List.of(id(10), id(20), id(30)));
        assertThat(list.search(id(20))).isEqualTo(1);
        assertThat(list.search(id(5))).isEqualTo(-1);
        assertThat(list.search(id(25))).isEqualTo(-3);
        assertThat(list.search(id(35))).isEqualTo(-4);
        assertThat(list.indexOf(id(30))).isEqualTo(2);
        assertThat(list.indexOf(id(31))).isEqualTo(-1);
        assertThat(list.indexOf("not an id")).isEqualTo(-1);
        assertThat(list.contains(id(10))).isTrue();
        assertThat(list.contains(id(11))).isFalse();
    }

    public void testRange() {
        IdentifierList list=new IdentifierList(List.of(id(10), id(20), id(30)));
        assertThat(list.range(1, 3)).containsExactly(id(20), id(30));
        assertThat(list.range(2, 2)).isEmpty();
        assertThatThrownBy(() -> list.range(2, 4)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    public void testBadSplice() {
        IdentifierList list=new IdentifierList(List.of(id(10), id(20)));
        assertThatThrownBy(() -> list.splice(1, 2, new Identifier[0])).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> list.splice(3, 0, new Identifier[0])).isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(list).containsExactly(id(10), id(20));
    }

    public void testFirstDisorder() {
        IdentifierList list=new IdentifierList(List.of(id(10), id(20), id(20), id(5)));
        assertThat(list.firstDisorder()).isEqualTo(2);
    }

    protected static Identifier id(long path) {
        return Identifier.of(path, 0, 1);
    }
}
