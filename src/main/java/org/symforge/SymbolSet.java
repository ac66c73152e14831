package org.symforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symforge.api.DataInfo;
import org.symforge.api.EnumerantInfo;
import org.symforge.api.FunctionInfo;
import org.symforge.api.ISymbolSet;
import org.symforge.api.MemberInfo;
import org.symforge.api.PublicInfo;
import org.symforge.api.SymbolAtOffset;
import org.symforge.api.SymbolBuilderException;
import org.symforge.api.SymbolErrorCode;
import org.symforge.api.SymbolInfo;
import org.symforge.api.TypeInfo;
import org.symforge.api.VariableInfo;
import org.symforge.arch.Location;
import org.symforge.arch.LocationFormat;
import org.symforge.arch.MachineArchitecture;
import org.symforge.config.SymbolSetOptions;
import org.symforge.convention.CallingConvention;
import org.symforge.convention.CallingConventions;
import org.symforge.disasm.IDisassembler;
import org.symforge.importer.ISymbolImporter;
import org.symforge.importer.ImportQueryKind;
import org.symforge.importer.SymbolImportException;
import org.symforge.model.OffsetMatch;
import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;
import org.symforge.model.functions.DataSymbol;
import org.symforge.model.functions.FunctionSymbol;
import org.symforge.model.functions.PublicSymbol;
import org.symforge.model.functions.Scope;
import org.symforge.model.functions.ScopeResolver;
import org.symforge.model.functions.VariableSymbol;
import org.symforge.model.index.AddressPointIndex;
import org.symforge.model.types.ArrayTypeSymbol;
import org.symforge.model.types.BaseClassSymbol;
import org.symforge.model.types.BasicCTypes;
import org.symforge.model.types.BasicTypeSymbol;
import org.symforge.model.types.EnumTypeSymbol;
import org.symforge.model.types.EnumerantSymbol;
import org.symforge.model.types.FieldSymbol;
import org.symforge.model.types.PointerKind;
import org.symforge.model.types.PointerTypeSymbol;
import org.symforge.model.types.PositionalMemberSymbol;
import org.symforge.model.types.TypeNameResolver;
import org.symforge.model.types.TypeSymbol;
import org.symforge.model.types.TypedefTypeSymbol;
import org.symforge.model.types.UdtTypeSymbol;
import org.symforge.model.types.IntrinsicKind;
import org.symforge.ranges.RangeBuildReport;
import org.symforge.ranges.RangeBuilder;
import org.symforge.session.ISymbolEventSink;
import org.symforge.session.ModuleInfo;
import org.symforge.session.RegisterContext;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * The symbol set of one module. Internally the symbol model reports failures with unchecked
 * {@link SymbolException}s; this class is the single boundary where they become checked
 * {@link SymbolBuilderException}s.
 */
public class SymbolSet implements ISymbolSet {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolSet.class);

    private final ModuleInfo module;
    private final MachineArchitecture architecture;
    private final SymbolSetOptions options;
    private final IDisassembler disassembler;
    private final SymbolStore store;
    private final TypeNameResolver typeNames;
    private final ScopeResolver scopes;
    private final LocationFormat locationFormat;

    private CallingConvention convention;
    private ISymbolImporter importer;
    private boolean importing;

    /**
     * @param module The module the symbols describe.
     * @param architecture The target architecture.
     * @param options The symbol set options.
     * @param disassembler The host disassembler, or null if range building is not available.
     * @param eventSink Receives a notification whenever the symbols change.
     */
    public SymbolSet(ModuleInfo module, MachineArchitecture architecture, SymbolSetOptions options,
                     IDisassembler disassembler, ISymbolEventSink eventSink) {
        this.module = Objects.requireNonNull(module, "module");
        this.architecture = Objects.requireNonNull(architecture, "architecture");
        this.options = Objects.requireNonNull(options, "options");
        this.disassembler = disassembler;
        this.store = new SymbolStore(architecture.pointerSize());
        this.typeNames = new TypeNameResolver(store, options.demandCreatePointerTypes(), options.demandCreateArrayTypes());
        this.scopes = new ScopeResolver(store);
        this.locationFormat = new LocationFormat(architecture.registers());

        if (options.addBasicCTypes()) {
            int added = BasicCTypes.addTo(store);
            LOG.debug("Added {} basic C types to '{}'", added, module.name());
        }
        ISymbolEventSink sink = eventSink == null ? ISymbolEventSink.none() : eventSink;
        store.addListener(() -> sink.symbolsChanged(module));
        LOG.info("Created symbol set for module '{}' at {}", module.name(), Long.toHexString(module.baseAddress()));
    }

    @Override
    public ModuleInfo module() {
        return module;
    }

    // region Symbols

    @Override
    public SymbolInfo getSymbol(long id) throws SymbolBuilderException {
        return guard("getSymbol", () -> toInfo(store.require(id)));
    }

    @Override
    public void deleteSymbol(long id) throws SymbolBuilderException {
        run("deleteSymbol", () -> store.delete(id));
    }

    @Override
    public long findByName(String name) throws SymbolBuilderException {
        return guard("findByName", () -> {
            importFor(ImportQueryKind.NAME, name, (source, target) -> source.importForNameQuery(target, name));
            OptionalLong id = store.findByName(name);
            if (id.isPresent()) {
                return id.getAsLong();
            }
            return store.symbols()
                    .filter(s -> s.kind() == SymbolKind.PUBLIC && name.equals(s.indexName()))
                    .map(Symbol::id)
                    .findFirst()
                    .orElseThrow(() -> SymbolException.notFound("No symbol named '%s'", name));
        });
    }

    @Override
    public SymbolAtOffset findByOffset(long moduleOffset, boolean exactOnly) throws SymbolBuilderException {
        return guard("findByOffset", () -> {
            importFor(ImportQueryKind.OFFSET, Long.toHexString(moduleOffset),
                    (source, target) -> source.importForOffsetQuery(target, moduleOffset));
            OffsetMatch match = store.findByOffset(moduleOffset, exactOnly)
                    .orElseThrow(() -> SymbolException.notFound("No symbol at offset %#x", moduleOffset));
            return new SymbolAtOffset(toInfo(store.require(match.symbolId())), match.residual());
        });
    }

    @Override
    public List<SymbolInfo> findGlobalsMatching(String pattern) throws SymbolBuilderException {
        return guard("findGlobalsMatching", () -> {
            Pattern compiled;
            try {
                compiled = Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw SymbolException.invalidArgument("Invalid pattern '%s': %s", pattern, e.getDescription());
            }
            importFor(ImportQueryKind.REGEX, pattern, (source, target) -> source.importForRegexQuery(target, pattern));
            return store.globalSymbols()
                    .filter(s -> s.indexName() != null && compiled.matcher(s.indexName()).matches())
                    .map(this::toInfo)
                    .collect(Collectors.toList());
        });
    }

    @Override
    public List<SymbolInfo> symbols() throws SymbolBuilderException {
        return guard("symbols", () -> store.symbols().map(this::toInfo).collect(Collectors.toList()));
    }

    @Override
    public List<SymbolInfo> globalSymbols() throws SymbolBuilderException {
        return guard("globalSymbols", () -> store.globalSymbols().map(this::toInfo).collect(Collectors.toList()));
    }

    @Override
    public List<SymbolInfo> children(long parentId, SymbolKind kind) throws SymbolBuilderException {
        return guard("children", () -> store.children(parentId, kind, (String) null)
                .map(this::toInfo)
                .collect(Collectors.toList()));
    }

    // endregion

    // region Types

    @Override
    public long addBasicType(String name, IntrinsicKind intrinsicKind, long size) throws SymbolBuilderException {
        return guard("addBasicType", () -> store.add(new BasicTypeSymbol(name, intrinsicKind, size)));
    }

    @Override
    public long addUdt(String name, String qualifiedName) throws SymbolBuilderException {
        return guard("addUdt", () -> store.add(new UdtTypeSymbol(name, qualifiedName)));
    }

    @Override
    public long addPointerType(long pointeeTypeId, PointerKind pointerKind) throws SymbolBuilderException {
        return guard("addPointerType", () -> {
            String name = store.require(pointeeTypeId).name() + pointerKind.suffix();
            Optional<PointerTypeSymbol> existing = findNamed(name, PointerTypeSymbol.class);
            if (existing.isPresent() && existing.get().typeId() == pointeeTypeId && existing.get().pointerKind() == pointerKind) {
                return existing.get().id();
            }
            return store.add(new PointerTypeSymbol(name, pointeeTypeId, pointerKind));
        });
    }

    @Override
    public long addArrayType(long elementTypeId, long dimension) throws SymbolBuilderException {
        return guard("addArrayType", () -> {
            String name = store.require(elementTypeId).name() + "[" + dimension + "]";
            Optional<ArrayTypeSymbol> existing = findNamed(name, ArrayTypeSymbol.class);
            if (existing.isPresent() && existing.get().typeId() == elementTypeId && existing.get().dimension() == dimension) {
                return existing.get().id();
            }
            return store.add(new ArrayTypeSymbol(name, elementTypeId, dimension));
        });
    }

    @Override
    public long addTypedef(String name, String qualifiedName, long targetTypeId) throws SymbolBuilderException {
        return guard("addTypedef", () -> store.add(new TypedefTypeSymbol(name, qualifiedName, targetTypeId)));
    }

    @Override
    public long addEnum(String name, String qualifiedName, long underlyingTypeId) throws SymbolBuilderException {
        return guard("addEnum", () -> store.add(new EnumTypeSymbol(name, qualifiedName, underlyingTypeId)));
    }

    @Override
    public long resolveTypeName(String typeName) throws SymbolBuilderException {
        return guard("resolveTypeName", () -> typeNames.resolve(typeName));
    }

    @Override
    public TypeInfo getType(long typeId) throws SymbolBuilderException {
        return guard("getType", () -> toTypeInfo(store.require(typeId, TypeSymbol.class)));
    }

    // endregion

    // region Members

    @Override
    public long addField(long udtId, String name, long typeId, Long offset) throws SymbolBuilderException {
        return guard("addField", () -> store.add(new FieldSymbol(udtId, name, typeId, offset)));
    }

    @Override
    public long addBaseClass(long udtId, long baseTypeId, Long offset) throws SymbolBuilderException {
        return guard("addBaseClass", () -> {
            String baseName = store.require(baseTypeId).name();
            return store.add(new BaseClassSymbol(udtId, baseName, baseTypeId, offset));
        });
    }

    @Override
    public MemberInfo getMember(long memberId) throws SymbolBuilderException {
        return guard("getMember", () -> {
            PositionalMemberSymbol member = store.require(memberId, PositionalMemberSymbol.class);
            return new MemberInfo(member.id(), member.kind(), member.parentId(), member.name(), member.typeId(),
                    member.offset(), member.isAutomaticLayout());
        });
    }

    @Override
    public void setMemberType(long memberId, long typeId) throws SymbolBuilderException {
        run("setMemberType", () -> store.require(memberId, PositionalMemberSymbol.class).setType(typeId));
    }

    @Override
    public void setMemberOffset(long memberId, long offset) throws SymbolBuilderException {
        run("setMemberOffset", () -> store.require(memberId, PositionalMemberSymbol.class).setOffset(offset));
    }

    @Override
    public void setMemberAutomaticLayout(long memberId) throws SymbolBuilderException {
        run("setMemberAutomaticLayout", () -> store.require(memberId, PositionalMemberSymbol.class).setAutomaticLayout());
    }

    @Override
    public void moveMemberBefore(long memberId, long position) throws SymbolBuilderException {
        run("moveMemberBefore", () -> store.require(memberId, PositionalMemberSymbol.class).moveToBefore(position));
    }

    @Override
    public long addEnumerant(long enumId, String name, Long value) throws SymbolBuilderException {
        return guard("addEnumerant", () -> store.add(new EnumerantSymbol(enumId, name, 0, value)));
    }

    @Override
    public EnumerantInfo getEnumerant(long enumerantId) throws SymbolBuilderException {
        return guard("getEnumerant", () -> {
            EnumerantSymbol enumerant = store.require(enumerantId, EnumerantSymbol.class);
            return new EnumerantInfo(enumerant.id(), enumerant.parentId(), enumerant.name(), enumerant.typeId(),
                    enumerant.value(), enumerant.isAutoIncrement());
        });
    }

    @Override
    public void setEnumerantValue(long enumerantId, long value) throws SymbolBuilderException {
        run("setEnumerantValue", () -> store.require(enumerantId, EnumerantSymbol.class).setValue(value));
    }

    @Override
    public void setEnumerantAutoIncrement(long enumerantId) throws SymbolBuilderException {
        run("setEnumerantAutoIncrement", () -> store.require(enumerantId, EnumerantSymbol.class).setAutoIncrement());
    }

    @Override
    public void moveEnumerantBefore(long enumerantId, long position) throws SymbolBuilderException {
        run("moveEnumerantBefore", () -> store.require(enumerantId, EnumerantSymbol.class).moveToBefore(position));
    }

    // endregion

    // region Data and publics

    @Override
    public long addData(String name, String qualifiedName, long typeId, long offset) throws SymbolBuilderException {
        return guard("addData", () -> store.add(new DataSymbol(name, qualifiedName, typeId, offset)));
    }

    @Override
    public DataInfo getData(long dataId) throws SymbolBuilderException {
        return guard("getData", () -> {
            DataSymbol data = store.require(dataId, DataSymbol.class);
            long size = store.resolveReference(data.typeId(), TypeSymbol.class).size();
            return new DataInfo(data.id(), data.name(), data.qualifiedName(), data.typeId(), data.offset(), size);
        });
    }

    @Override
    public void setDataOffset(long dataId, long offset) throws SymbolBuilderException {
        run("setDataOffset", () -> store.require(dataId, DataSymbol.class).setOffset(offset));
    }

    @Override
    public void setDataType(long dataId, long typeId) throws SymbolBuilderException {
        run("setDataType", () -> store.require(dataId, DataSymbol.class).setType(typeId));
    }

    @Override
    public long addPublic(String name, String qualifiedName, long offset) throws SymbolBuilderException {
        return guard("addPublic", () -> store.add(new PublicSymbol(name, qualifiedName, offset)));
    }

    @Override
    public PublicInfo getPublic(long publicId) throws SymbolBuilderException {
        return guard("getPublic", () -> {
            PublicSymbol symbol = store.require(publicId, PublicSymbol.class);
            return new PublicInfo(symbol.id(), symbol.name(), symbol.qualifiedName(), symbol.offset());
        });
    }

    @Override
    public SymbolAtOffset findNearestPublic(long moduleOffset) throws SymbolBuilderException {
        return guard("findNearestPublic", () -> {
            AddressPointIndex.PointMatch match = store.publicIndex().findNearestAtOrBefore(moduleOffset)
                    .orElseThrow(() -> SymbolException.notFound("No public symbol at or before %#x", moduleOffset));
            Symbol symbol = store.resolveReference(match.ids().getLong(0), PublicSymbol.class);
            return new SymbolAtOffset(toInfo(symbol), moduleOffset - match.address());
        });
    }

    // endregion

    // region Functions and variables

    @Override
    public long addFunction(String name, String qualifiedName, long returnTypeId, long offset, long size)
            throws SymbolBuilderException {
        return guard("addFunction", () -> store.add(new FunctionSymbol(name, qualifiedName, returnTypeId, offset, size)));
    }

    @Override
    public FunctionInfo getFunction(long functionId) throws SymbolBuilderException {
        return guard("getFunction", () -> {
            FunctionSymbol function = store.require(functionId, FunctionSymbol.class);
            return new FunctionInfo(function.id(), function.name(), function.qualifiedName(), function.returnTypeId(),
                    function.ranges(), idsOf(function.parameters()), idsOf(function.locals()));
        });
    }

    @Override
    public void addFunctionRange(long functionId, long offset, long size) throws SymbolBuilderException {
        run("addFunctionRange", () -> store.require(functionId, FunctionSymbol.class).addRange(offset, size));
    }

    @Override
    public void removeFunctionRange(long functionId, long offset, long size) throws SymbolBuilderException {
        run("removeFunctionRange", () -> store.require(functionId, FunctionSymbol.class).removeRange(offset, size));
    }

    @Override
    public void setFunctionReturnType(long functionId, long returnTypeId) throws SymbolBuilderException {
        run("setFunctionReturnType", () -> store.require(functionId, FunctionSymbol.class).setReturnType(returnTypeId));
    }

    @Override
    public long getFunctionType(long functionId) throws SymbolBuilderException {
        return guard("getFunctionType", () -> store.require(functionId, FunctionSymbol.class).functionType());
    }

    @Override
    public long addParameter(long functionId, String name, long typeId) throws SymbolBuilderException {
        return guard("addParameter", () -> store.add(new VariableSymbol(SymbolKind.PARAMETER, functionId, name, typeId)));
    }

    @Override
    public long addLocal(long functionId, String name, long typeId) throws SymbolBuilderException {
        return guard("addLocal", () -> store.add(new VariableSymbol(SymbolKind.LOCAL, functionId, name, typeId)));
    }

    @Override
    public VariableInfo getVariable(long variableId) throws SymbolBuilderException {
        return guard("getVariable", () -> {
            VariableSymbol variable = store.require(variableId, VariableSymbol.class);
            return new VariableInfo(variable.id(), variable.kind(), variable.parentId(), variable.name(),
                    variable.typeId(), variable.liveRanges());
        });
    }

    @Override
    public void setVariableType(long variableId, long typeId) throws SymbolBuilderException {
        run("setVariableType", () -> store.require(variableId, VariableSymbol.class).setType(typeId));
    }

    @Override
    public void moveParameterBefore(long parameterId, long position) throws SymbolBuilderException {
        run("moveParameterBefore", () -> store.require(parameterId, VariableSymbol.class).moveToBefore(position));
    }

    @Override
    public long addLiveRange(long variableId, long offset, long size, Location location) throws SymbolBuilderException {
        return guard("addLiveRange", () -> store.require(variableId, VariableSymbol.class).addLiveRange(offset, size, location));
    }

    @Override
    public void setLiveRangeOffset(long variableId, long rangeId, long offset) throws SymbolBuilderException {
        run("setLiveRangeOffset", () -> store.require(variableId, VariableSymbol.class).setLiveRangeOffset(rangeId, offset));
    }

    @Override
    public void setLiveRangeSize(long variableId, long rangeId, long size) throws SymbolBuilderException {
        run("setLiveRangeSize", () -> store.require(variableId, VariableSymbol.class).setLiveRangeSize(rangeId, size));
    }

    @Override
    public void setLiveRangeLocation(long variableId, long rangeId, Location location) throws SymbolBuilderException {
        run("setLiveRangeLocation", () -> store.require(variableId, VariableSymbol.class).setLiveRangeLocation(rangeId, location));
    }

    @Override
    public void deleteLiveRange(long variableId, long rangeId) throws SymbolBuilderException {
        run("deleteLiveRange", () -> store.require(variableId, VariableSymbol.class).deleteLiveRange(rangeId));
    }

    @Override
    public void deleteAllLiveRanges(long variableId) throws SymbolBuilderException {
        run("deleteAllLiveRanges", () -> store.require(variableId, VariableSymbol.class).deleteAllLiveRanges());
    }

    @Override
    public Location getVariableLocation(long variableId) throws SymbolBuilderException {
        return guard("getVariableLocation", () -> store.require(variableId, VariableSymbol.class).unboundLocation());
    }

    // endregion

    // region Scopes and analysis

    @Override
    public Scope findScopeByOffset(long moduleOffset) throws SymbolBuilderException {
        return guard("findScopeByOffset", () -> {
            importFor(ImportQueryKind.OFFSET, Long.toHexString(moduleOffset),
                    (source, target) -> source.importForOffsetQuery(target, moduleOffset));
            return scopes.findByOffset(moduleOffset);
        });
    }

    @Override
    public Scope findScopeFrame(RegisterContext context) throws SymbolBuilderException {
        if (context == null) {
            throw new SymbolBuilderException(SymbolErrorCode.INVALID_ARGUMENT, "findScopeFrame needs a register context");
        }
        return findScopeByOffset(context.instructionPointer() - module.baseAddress());
    }

    @Override
    public List<Location> placeParameters(long functionId) throws SymbolBuilderException {
        return guard("placeParameters", () -> {
            FunctionSymbol function = store.require(functionId, FunctionSymbol.class);
            return convention().placeParameters(store, function);
        });
    }

    @Override
    public RangeBuildReport buildParameterRanges(long functionId) throws SymbolBuilderException {
        return guard("buildParameterRanges", () -> {
            if (disassembler == null) {
                throw SymbolException.unsupported("No disassembler available for module '%s'", module.name());
            }
            FunctionSymbol function = store.require(functionId, FunctionSymbol.class);
            RangeBuilder builder = new RangeBuilder(disassembler, options.aliasMnemonics());
            return builder.build(store, function, convention(), module.baseAddress());
        });
    }

    @Override
    public String formatLocation(Location location) throws SymbolBuilderException {
        return guard("formatLocation", () -> locationFormat.format(location));
    }

    @Override
    public Location parseLocation(String text) throws SymbolBuilderException {
        return guard("parseLocation", () -> locationFormat.parse(text));
    }

    // endregion

    // region Import

    @Override
    public void connectImporter(ISymbolImporter newImporter) throws SymbolBuilderException {
        if (newImporter == null) {
            throw new SymbolBuilderException(SymbolErrorCode.INVALID_ARGUMENT, "connectImporter needs an importer");
        }
        disconnectImporter();
        try {
            newImporter.connect();
        } catch (SymbolImportException e) {
            throw new SymbolBuilderException(SymbolErrorCode.IMPORT_FAILURE,
                    "Failed to connect importer for '" + module.name() + "': " + e.getMessage(), e);
        }
        importer = newImporter;
        LOG.info("Connected symbol importer to '{}'", module.name());
    }

    @Override
    public void disconnectImporter() {
        if (importer == null) {
            return;
        }
        ISymbolImporter previous = importer;
        importer = null;
        try {
            previous.disconnect();
        } catch (RuntimeException e) {
            LOG.warn("Importer of '{}' failed to disconnect: {}", module.name(), e.getMessage());
        }
    }

    @FunctionalInterface
    private interface ImportCall {
        boolean run(ISymbolImporter source, ISymbolSet target) throws SymbolImportException;
    }

    /**
     * Gives the connected importer a chance to add symbols for a lookup. Failures never fail the lookup,
     * and lookups made by the importer itself do not import again.
     */
    private void importFor(ImportQueryKind kind, String query, ImportCall call) {
        if (importer == null || importing) {
            return;
        }
        importing = true;
        try {
            if (call.run(importer, this)) {
                LOG.debug("Imported symbols for {} query '{}' into '{}'", kind, query, module.name());
            }
        } catch (SymbolImportException | RuntimeException e) {
            LOG.warn("Import for {} query '{}' failed: {}", kind, query, e.getMessage());
        } finally {
            importing = false;
        }
    }

    // endregion

    // region Helpers

    private CallingConvention convention() {
        if (convention == null) {
            convention = CallingConventions.defaultFor(architecture);
        }
        return convention;
    }

    private <T extends TypeSymbol> Optional<T> findNamed(String name, Class<T> type) {
        OptionalLong id = store.findByName(name);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        Symbol symbol = store.require(id.getAsLong());
        return type.isInstance(symbol) ? Optional.of(type.cast(symbol)) : Optional.empty();
    }

    private SymbolInfo toInfo(Symbol symbol) {
        return new SymbolInfo(symbol.id(), symbol.kind(), symbol.name(), symbol.qualifiedName(), symbol.parentId(),
                symbol.childIds());
    }

    private TypeInfo toTypeInfo(TypeSymbol type) {
        long baseTypeId = 0;
        IntrinsicKind intrinsicKind = null;
        PointerKind pointerKind = null;
        long dimension = 0;
        if (type instanceof BasicTypeSymbol basic) {
            intrinsicKind = basic.intrinsicKind();
        } else if (type instanceof PointerTypeSymbol pointer) {
            baseTypeId = pointer.typeId();
            pointerKind = pointer.pointerKind();
        } else if (type instanceof ArrayTypeSymbol array) {
            baseTypeId = array.typeId();
            dimension = array.dimension();
        } else if (type instanceof TypedefTypeSymbol typedef) {
            baseTypeId = typedef.typeId();
        } else if (type instanceof EnumTypeSymbol enumType) {
            baseTypeId = enumType.typeId();
        }
        return new TypeInfo(type.id(), type.name(), type.qualifiedName(), type.typeKind(), type.size(), type.alignment(),
                baseTypeId, intrinsicKind, pointerKind, dimension);
    }

    private static List<Long> idsOf(List<? extends Symbol> symbols) {
        return symbols.stream().map(Symbol::id).collect(Collectors.toList());
    }

    private void run(String operation, Runnable body) throws SymbolBuilderException {
        guard(operation, () -> {
            body.run();
            return null;
        });
    }

    private <T> T guard(String operation, Supplier<T> body) throws SymbolBuilderException {
        try {
            return body.get();
        } catch (SymbolException e) {
            LOG.debug("{} failed on '{}': {}", operation, module.name(), e.getMessage());
            throw new SymbolBuilderException(e.getCode(), e.getMessage(), e);
        } catch (ArithmeticException e) {
            throw new SymbolBuilderException(SymbolErrorCode.INVALID_ARGUMENT,
                    operation + " overflowed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure in {} on '{}'", operation, module.name(), e);
            throw new SymbolBuilderException(SymbolErrorCode.UNEXPECTED,
                    operation + " failed unexpectedly: " + e.getMessage(), e);
        }
    }

    // endregion
}
