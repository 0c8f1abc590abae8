package edu.uiuc.cs.dais.cdg.tool;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;

import com.ibm.wala.classLoader.IClass;
import com.ibm.wala.classLoader.IMethod;
import com.ibm.wala.core.util.config.AnalysisScopeReader;
import com.ibm.wala.ipa.callgraph.AnalysisCacheImpl;
import com.ibm.wala.ipa.callgraph.AnalysisScope;
import com.ibm.wala.ipa.callgraph.IAnalysisCacheView;
import com.ibm.wala.ipa.callgraph.impl.Everywhere;
import com.ibm.wala.ipa.cha.ClassHierarchyFactory;
import com.ibm.wala.ipa.cha.IClassHierarchy;
import com.ibm.wala.ssa.IR;
import com.ibm.wala.ssa.ISSABasicBlock;
import com.ibm.wala.types.ClassLoaderReference;
import com.ibm.wala.types.TypeName;
import com.ibm.wala.types.TypeReference;
import com.ibm.wala.util.viz.NodeDecorator;

import edu.uiuc.cs.dais.cdg.ControlDependenceGraph;
import edu.uiuc.cs.dais.cdg.ControlDependenceOptions;
import edu.uiuc.cs.dais.cdg.dot.DotWriter;

/**
 * Prints the control dependence graphs of a method in dot format.
 */
public class CdgPrinter {

	/**
	 * Sample parameters:
	 * <ol>
	 * <li>target/classes</li>
	 * <li>Lsample/Algorithms</li>
	 * <li>binarySearch</li>
	 * </ol>
	 * Flags <code>-raw</code> (no region nodes) and <code>-noexc</code> (ignore exceptional control flow) may precede
	 * the parameters.
	 */
	public static void main(String[] args) throws Exception {
		final ControlDependenceOptions options = new ControlDependenceOptions();
		List<String> params = new ArrayList<>();
		for (String arg : args) {
			if (arg.equals("-raw"))
				options.setInsertRegions(false);
			else if (arg.equals("-noexc"))
				options.setPruneExceptionalEdges(true);
			else
				params.add(arg);
		}
		if (params.size() != 3 && params.size() != 4) {
			System.err.println("usage: [-raw] [-noexc] {classpath} {class-name} {method-name} {output-file}?");
			System.exit(-1);
		}

		final String classpath = params.get(0);
		final String className = params.get(1);
		final String methodName = params.get(2);
		final File output = params.size() == 4 ? new File(params.get(3)) : null;

		final AnalysisScope scope = createAnalysisScope(classpath).timed();
		final IClassHierarchy cha = makeClassHierarchy(scope).timed();
		final Collection<IMethod> methods = findMethods(cha, className, methodName);
		if (methods.isEmpty()) {
			System.err.println("No method " + methodName + " with a body in class " + className);
			System.exit(-1);
		}

		final IAnalysisCacheView cache = new AnalysisCacheImpl();
		StringBuilder dot = new StringBuilder();
		for (final IMethod method : methods) {
			System.err.println("Processing " + method.getSignature());
			final IR ir = cache.getIR(method, Everywhere.EVERYWHERE);
			ControlDependenceGraph<ISSABasicBlock> cdg = makeControlDependenceGraph(ir, options).timed();
			System.err.println("Control dependence graph size: " + cdg.getNumberOfNodes());
			dot.append("// ").append(method.getSignature()).append('\n');
			dot.append(new DotWriter<>(cdg, BLOCK_LABELS).toDot());
		}

		if (output == null) {
			Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
			out.write(dot.toString());
			out.flush();
		} else {
			try (Writer out = new OutputStreamWriter(new FileOutputStream(output), StandardCharsets.UTF_8)) {
				out.write(dot.toString());
			}
		}
	}

	static final NodeDecorator<ISSABasicBlock> BLOCK_LABELS = new NodeDecorator<ISSABasicBlock>() {
		@Override
		public String getLabel(ISSABasicBlock block) {
			if (block.isEntryBlock())
				return "ENTRY";
			if (block.isExitBlock())
				return "EXIT";
			return "BB" + block.getNumber();
		}
	};

	static Collection<IMethod> findMethods(IClassHierarchy cha, String className, String methodName) {
		TypeName typeName = TypeName.string2TypeName(className);
		TypeReference type = TypeReference.findOrCreate(ClassLoaderReference.Application, typeName);
		IClass cls = cha.lookupClass(type);
		if (cls == null)
			throw new IllegalArgumentException("Class " + className + " not found on the application classpath");
		Collection<IMethod> methods = new ArrayList<>();
		for (IMethod m : cls.getDeclaredMethods())
			if (m.getName().toString().equals(methodName) && !m.isAbstract() && !m.isNative())
				methods.add(m);
		return methods;
	}

	static TimedCallable<AnalysisScope> createAnalysisScope(final String classpath) {
		return createAnalysisScope(classpath, null);
	}

	/**
	 * @param exclusions
	 *            file listing the library classes to leave out of the scope, or null to keep all of them
	 */
	static TimedCallable<AnalysisScope> createAnalysisScope(final String classpath, final File exclusions) {
		return new TimedCallable<AnalysisScope>(AnalysisScope.class) {
			@Override
			public AnalysisScope call() throws Exception {
				for (String entry : classpath.split(File.pathSeparator))
					if (!new File(entry).exists())
						throw new IOException("Classpath entry " + entry + " does not exist");
				return AnalysisScopeReader.instance.makeJavaBinaryAnalysisScope(classpath, exclusions);
			}
		};
	}

	static TimedCallable<IClassHierarchy> makeClassHierarchy(final AnalysisScope scope) {
		return new TimedCallable<IClassHierarchy>(IClassHierarchy.class) {
			@Override
			public IClassHierarchy call() throws Exception {
				return ClassHierarchyFactory.make(scope);
			}
		};
	}

	static TimedCallable<ControlDependenceGraph<ISSABasicBlock>> makeControlDependenceGraph(final IR ir,
			final ControlDependenceOptions options) {
		return new TimedCallable<ControlDependenceGraph<ISSABasicBlock>>("CDG") {
			@Override
			public ControlDependenceGraph<ISSABasicBlock> call() throws Exception {
				return ControlDependenceGraph.load(ir, options);
			}
		};
	}

	/**
	 * Utility class to time stuff.
	 *
	 * @param <T>
	 *            return type
	 */
	static abstract class TimedCallable<T> implements Callable<T> {

		private final String label;

		TimedCallable(String label) {
			this.label = label;
		}

		TimedCallable(Class<?> klass) {
			this(klass.getSimpleName());
		}

		public T timed() throws Exception {
			long before = System.currentTimeMillis();
			try {
				return call();
			} finally {
				System.err.println(label + ": " + (System.currentTimeMillis() - before));
			}
		}
	}
}
