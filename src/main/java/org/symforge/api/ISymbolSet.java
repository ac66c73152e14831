package org.symforge.api;

import org.symforge.arch.Location;
import org.symforge.importer.ISymbolImporter;
import org.symforge.model.SymbolKind;
import org.symforge.model.functions.Scope;
import org.symforge.model.types.IntrinsicKind;
import org.symforge.model.types.PointerKind;
import org.symforge.ranges.RangeBuildReport;
import org.symforge.session.ModuleInfo;
import org.symforge.session.RegisterContext;

import java.util.List;

/**
 * The synthetic symbols of one module. Every operation either completes or throws a
 * {@link SymbolBuilderException}; no other exception crosses this interface.
 * <p>
 * Offsets are relative to the module base unless stated otherwise. Member offsets, enumerant values and
 * type sizes are recomputed whenever something they depend on changes.
 */
public interface ISymbolSet {

    ModuleInfo module();

    // region Symbols

    /**
     * @param id The symbol id.
     * @return The common view of the symbol.
     * @throws SymbolBuilderException {@code NOT_FOUND} if the id does not exist (any more).
     */
    SymbolInfo getSymbol(long id) throws SymbolBuilderException;

    /**
     * Deletes a symbol and the symbols it owns. Symbols that merely reference it are left in place.
     */
    void deleteSymbol(long id) throws SymbolBuilderException;

    /**
     * Looks up a global symbol by qualified name, or by name when it has none.
     *
     * @return The id of the symbol.
     * @throws SymbolBuilderException {@code NOT_FOUND} if no global symbol has that name.
     */
    long findByName(String name) throws SymbolBuilderException;

    /**
     * Finds the symbol covering a module offset: data and functions by their extent, publics only at
     * their exact offset.
     *
     * @param moduleOffset The offset from the module base.
     * @param exactOnly Whether only a symbol starting exactly at the offset qualifies.
     * @throws SymbolBuilderException {@code NOT_FOUND} if nothing qualifies.
     */
    SymbolAtOffset findByOffset(long moduleOffset, boolean exactOnly) throws SymbolBuilderException;

    /**
     * @param pattern A regular expression matched against the whole name (or qualified name).
     * @return The global symbols whose name matches.
     * @throws SymbolBuilderException {@code INVALID_ARGUMENT} if the pattern does not compile.
     */
    List<SymbolInfo> findGlobalsMatching(String pattern) throws SymbolBuilderException;

    List<SymbolInfo> symbols() throws SymbolBuilderException;

    List<SymbolInfo> globalSymbols() throws SymbolBuilderException;

    /**
     * @param kind Only children of this kind, or all children if null.
     */
    List<SymbolInfo> children(long parentId, SymbolKind kind) throws SymbolBuilderException;

    // endregion

    // region Types

    long addBasicType(String name, IntrinsicKind intrinsicKind, long size) throws SymbolBuilderException;

    long addUdt(String name, String qualifiedName) throws SymbolBuilderException;

    long addPointerType(long pointeeTypeId, PointerKind pointerKind) throws SymbolBuilderException;

    long addArrayType(long elementTypeId, long dimension) throws SymbolBuilderException;

    long addTypedef(String name, String qualifiedName, long targetTypeId) throws SymbolBuilderException;

    /**
     * @param underlyingTypeId A basic ordinal type of size 1, 2, 4 or 8.
     * @throws SymbolBuilderException {@code INVALID_ARGUMENT} if the underlying type cannot back an enum.
     */
    long addEnum(String name, String qualifiedName, long underlyingTypeId) throws SymbolBuilderException;

    /**
     * Resolves a type name such as {@code "int"}, {@code "Foo*"} or {@code "char[16]"}, creating derived
     * pointer and array types on first use when the options allow it.
     *
     * @return The id of the type.
     * @throws SymbolBuilderException {@code NOT_FOUND} for unknown names, {@code INVALID_ARGUMENT} for
     *                                malformed ones, {@code UNSUPPORTED} if creation is disabled.
     */
    long resolveTypeName(String typeName) throws SymbolBuilderException;

    TypeInfo getType(long typeId) throws SymbolBuilderException;

    // endregion

    // region Members

    /**
     * @param offset The offset within the owner, or null for automatic layout.
     */
    long addField(long udtId, String name, long typeId, Long offset) throws SymbolBuilderException;

    /**
     * @param offset The offset within the owner, or null for automatic layout.
     */
    long addBaseClass(long udtId, long baseTypeId, Long offset) throws SymbolBuilderException;

    MemberInfo getMember(long memberId) throws SymbolBuilderException;

    void setMemberType(long memberId, long typeId) throws SymbolBuilderException;

    void setMemberOffset(long memberId, long offset) throws SymbolBuilderException;

    void setMemberAutomaticLayout(long memberId) throws SymbolBuilderException;

    /**
     * Moves a member before the member at {@code position}, counted among members of the same kind.
     */
    void moveMemberBefore(long memberId, long position) throws SymbolBuilderException;

    /**
     * @param value The explicit value, or null to continue from the previous enumerant.
     */
    long addEnumerant(long enumId, String name, Long value) throws SymbolBuilderException;

    EnumerantInfo getEnumerant(long enumerantId) throws SymbolBuilderException;

    void setEnumerantValue(long enumerantId, long value) throws SymbolBuilderException;

    void setEnumerantAutoIncrement(long enumerantId) throws SymbolBuilderException;

    void moveEnumerantBefore(long enumerantId, long position) throws SymbolBuilderException;

    // endregion

    // region Data and publics

    long addData(String name, String qualifiedName, long typeId, long offset) throws SymbolBuilderException;

    DataInfo getData(long dataId) throws SymbolBuilderException;

    void setDataOffset(long dataId, long offset) throws SymbolBuilderException;

    void setDataType(long dataId, long typeId) throws SymbolBuilderException;

    long addPublic(String name, String qualifiedName, long offset) throws SymbolBuilderException;

    PublicInfo getPublic(long publicId) throws SymbolBuilderException;

    /**
     * @return The public at or nearest before the offset, with the distance to it.
     * @throws SymbolBuilderException {@code NOT_FOUND} if no public lies at or before the offset.
     */
    SymbolAtOffset findNearestPublic(long moduleOffset) throws SymbolBuilderException;

    // endregion

    // region Functions and variables

    /**
     * @param returnTypeId The return type, or 0 for none.
     */
    long addFunction(String name, String qualifiedName, long returnTypeId, long offset, long size) throws SymbolBuilderException;

    FunctionInfo getFunction(long functionId) throws SymbolBuilderException;

    void addFunctionRange(long functionId, long offset, long size) throws SymbolBuilderException;

    void removeFunctionRange(long functionId, long offset, long size) throws SymbolBuilderException;

    void setFunctionReturnType(long functionId, long returnTypeId) throws SymbolBuilderException;

    /**
     * @return The id of the function type matching the current return and parameter types.
     */
    long getFunctionType(long functionId) throws SymbolBuilderException;

    long addParameter(long functionId, String name, long typeId) throws SymbolBuilderException;

    long addLocal(long functionId, String name, long typeId) throws SymbolBuilderException;

    VariableInfo getVariable(long variableId) throws SymbolBuilderException;

    void setVariableType(long variableId, long typeId) throws SymbolBuilderException;

    void moveParameterBefore(long parameterId, long position) throws SymbolBuilderException;

    /**
     * @param offset The function-relative start.
     * @return The id of the new range, unique within the variable.
     * @throws SymbolBuilderException {@code INVALID_ARGUMENT} if the range leaves the function ranges or
     *                                overlaps another range of the variable.
     */
    long addLiveRange(long variableId, long offset, long size, Location location) throws SymbolBuilderException;

    void setLiveRangeOffset(long variableId, long rangeId, long offset) throws SymbolBuilderException;

    void setLiveRangeSize(long variableId, long rangeId, long size) throws SymbolBuilderException;

    void setLiveRangeLocation(long variableId, long rangeId, Location location) throws SymbolBuilderException;

    void deleteLiveRange(long variableId, long rangeId) throws SymbolBuilderException;

    void deleteAllLiveRanges(long variableId) throws SymbolBuilderException;

    /**
     * @return The location of a variable that holds it over its whole single-range function.
     * @throws SymbolBuilderException {@code NOT_FOUND} if the location depends on the code offset.
     */
    Location getVariableLocation(long variableId) throws SymbolBuilderException;

    // endregion

    // region Scopes and analysis

    /**
     * @throws SymbolBuilderException {@code NOT_FOUND} if no function covers the offset.
     */
    Scope findScopeByOffset(long moduleOffset) throws SymbolBuilderException;

    /**
     * Finds the scope of a stopped thread from its instruction pointer.
     */
    Scope findScopeFrame(RegisterContext context) throws SymbolBuilderException;

    /**
     * @return The entry location of each parameter under the architecture's default calling convention.
     * @throws SymbolBuilderException {@code UNSUPPORTED} if the architecture has no known convention.
     */
    List<Location> placeParameters(long functionId) throws SymbolBuilderException;

    /**
     * Replaces the live ranges of the function's parameters with ranges derived from its disassembly.
     *
     * @throws SymbolBuilderException {@code UNSUPPORTED} without a disassembler or known convention.
     */
    RangeBuildReport buildParameterRanges(long functionId) throws SymbolBuilderException;

    String formatLocation(Location location) throws SymbolBuilderException;

    Location parseLocation(String text) throws SymbolBuilderException;

    // endregion

    // region Import

    /**
     * Connects a secondary symbol source that lookups consult first.
     *
     * @throws SymbolBuilderException {@code IMPORT_FAILURE} if the source cannot be opened.
     */
    void connectImporter(ISymbolImporter importer) throws SymbolBuilderException;

    void disconnectImporter();

    // endregion
}
