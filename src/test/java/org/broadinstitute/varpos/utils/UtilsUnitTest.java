package org.broadinstitute.varpos.utils;

import com.google.common.collect.Sets;
import org.broadinstitute.varpos.VarPosBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.*;

public final class UtilsUnitTest extends VarPosBaseTest {

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonNullThrows(){
        final Object o = null;
        Utils.nonNull(o);
    }

    @Test
    public void testNonNullDoesNotThrow(){
        final Object o = new Object();
        Assert.assertSame(Utils.nonNull(o), o);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "^The exception message$")
    public void testNonNullWithMessageThrows() {
        Utils.nonNull(null, "The exception message");
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "^supplied message$")
    public void testNonNullWithSupplierThrows() {
        Utils.nonNull(null, () -> "supplied message");
    }

    @Test
    public void testNonNullWithMessageReturn() {
        final Object testObject = new Object();
        Assert.assertSame(Utils.nonNull(testObject, "some message"), testObject);
    }

    @DataProvider
    public Object[][] getNonNullCollections(){
        final List<String> someValues = Arrays.asList("some", "values");
        return new Object[][]{
                {Collections.emptyList()},
                {Collections.emptySet()},
                {someValues},
                {new HashSet<>(someValues)},
                {new TreeSet<>(someValues)},
        };
    }

    @DataProvider
    public Object[][] getCollectionsWithNulls(){
        return new Object[][]{
                {null},
                {Arrays.asList("something", null)},
                {Sets.newHashSet("something", null)},
        };
    }

    @Test(dataProvider = "getNonNullCollections")
    public void testContainsNoNull(Collection<?> collection){
        Utils.containsNoNull(collection, "bad");
    }

    @Test(dataProvider = "getCollectionsWithNulls", expectedExceptions = IllegalArgumentException.class)
    public void testContainsNull( Collection<?> collection){
        Utils.containsNoNull(collection, "This was expected");
    }

    @Test
    public void testValidateArg() {
        Utils.validateArg(true, "not thrown");
        Utils.validateArg(true, () -> "not thrown");
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.validateArg(false, "thrown"));
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.validateArg(false, () -> "thrown"));
    }

    @Test
    public void testValidate() {
        Utils.validate(true, "not thrown");
        Utils.validate(true, () -> "not thrown");
        Assert.assertThrows(IllegalStateException.class, () -> Utils.validate(false, "thrown"));
        Assert.assertThrows(IllegalStateException.class, () -> Utils.validate(false, () -> "thrown"));
    }
}
